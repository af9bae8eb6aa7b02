package com.customdim.controller.rest;

import com.customdim.api.dto.ConfigureExistingDimensionRequest;
import com.customdim.api.dto.ConfigureNewDimensionRequest;
import com.customdim.api.dto.CustomDimensionView;
import com.customdim.service.core.api.CustomDimensionsApi;
import com.customdim.service.core.api.ExtractionDimensionOption;
import com.customdim.service.core.api.ScopeAvailability;
import com.customdim.service.core.report.ReportTable;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class CustomDimensionsController {

    private static final Logger log = LoggerFactory.getLogger(CustomDimensionsController.class);

    private final CustomDimensionsApi api;

    public CustomDimensionsController(CustomDimensionsApi api) {
        this.api = api;
    }

    @GetMapping("/sites/{siteId}/custom-dimensions/{idDimension}/report")
    public ReportTable report(
            @PathVariable("siteId") int siteId,
            @PathVariable("idDimension") long idDimension,
            @RequestParam("period") String period,
            @RequestParam("date") String date,
            @RequestParam(value = "segment", required = false) String segment,
            @RequestParam(value = "expanded", required = false, defaultValue = "false") boolean expanded,
            @RequestParam(value = "idSubtable", required = false) Long idSubtable) {
        return api.getCustomDimension(idDimension, siteId, period, date, segment, expanded, idSubtable);
    }

    @PostMapping(value = "/sites/{siteId}/custom-dimensions", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> configureNew(
            @PathVariable("siteId") int siteId, @Valid @RequestBody ConfigureNewDimensionRequest body) {
        if (log.isInfoEnabled()) {
            log.info("POST custom dimension: site={}, scope={}, name={}", siteId, body.getScope(), body.getName());
        }
        long id = api.configureNewCustomDimension(
                siteId, body.getName(), body.getScope(), body.getActive(), body.getExtractions(), body.getCaseSensitive());
        return Map.of("idDimension", id);
    }

    @PutMapping(value = "/sites/{siteId}/custom-dimensions/{idDimension}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> configureExisting(
            @PathVariable("siteId") int siteId,
            @PathVariable("idDimension") long idDimension,
            @Valid @RequestBody ConfigureExistingDimensionRequest body) {
        api.configureExistingCustomDimension(
                idDimension, siteId, body.getName(), body.getActive(), body.getExtractions(), body.getCaseSensitive());
        return Map.of("status", "ok", "idDimension", idDimension);
    }

    @GetMapping("/sites/{siteId}/custom-dimensions")
    public List<CustomDimensionView> configured(@PathVariable("siteId") int siteId) {
        return api.getConfiguredCustomDimensions(siteId).stream()
                .map(CustomDimensionView::from)
                .toList();
    }

    @GetMapping("/sites/{siteId}/custom-dimensions/scopes")
    public List<ScopeAvailability> scopes(@PathVariable("siteId") int siteId) {
        return api.getAvailableScopes(siteId);
    }

    @GetMapping("/custom-dimensions/extraction-dimensions")
    public List<ExtractionDimensionOption> extractionDimensions() {
        return api.getAvailableExtractionDimensions();
    }
}
