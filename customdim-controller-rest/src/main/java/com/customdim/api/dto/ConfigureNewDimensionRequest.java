package com.customdim.api.dto;

import com.customdim.core.model.ExtractionRule;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.Data;

@Data
public class ConfigureNewDimensionRequest {

    private String name;

    /** {@code visit} or {@code action}. */
    private String scope;

    /** 0/1 or boolean. */
    @NotNull private Object active;

    /** Evaluated in list order at tracking time. */
    private List<ExtractionRule> extractions;

    /** 0/1 or boolean, defaults to case sensitive. */
    private Object caseSensitive;
}
