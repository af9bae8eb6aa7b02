package com.customdim.api.dto;

import com.customdim.core.model.CustomDimension;
import com.customdim.core.model.ExtractionRule;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record CustomDimensionView(
        @JsonProperty("idcustomdimension") long idCustomDimension,
        @JsonProperty("idsite") int idSite,
        String name,
        int index,
        String scope,
        boolean active,
        List<ExtractionRule> extractions,
        @JsonProperty("case_sensitive") boolean caseSensitive) {

    public static CustomDimensionView from(CustomDimension d) {
        return new CustomDimensionView(
                d.id(), d.siteId(), d.name(), d.index(), d.scope().value(), d.active(), d.extractions(), d.caseSensitive());
    }
}
