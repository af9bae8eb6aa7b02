package com.customdim.api.dto;

import com.customdim.core.model.ExtractionRule;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.Data;

/** Full replacement of a dimension's mutable values; omitted extractions clear them. */
@Data
public class ConfigureExistingDimensionRequest {

    private String name;

    @NotNull private Object active;

    private List<ExtractionRule> extractions;

    private Object caseSensitive;
}
