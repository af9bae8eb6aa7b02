package com.customdim.core.model;

import com.customdim.core.error.CustomDimensionException;
import com.customdim.core.error.ErrorCode;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Granularity a custom dimension applies to. Each scope owns a separate pool of physical slots in
 * its own log table.
 */
public enum Scope {
    VISIT("visit", "log_visit"),
    ACTION("action", "log_link_visit_action");

    private final String value;
    private final String logTable;

    Scope(String value, String logTable) {
        this.value = value;
        this.logTable = logTable;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Log table holding the {@code custom_dimension_<n>} columns of this scope. */
    public String logTable() {
        return logTable;
    }

    /**
     * Resolves a wire value to a scope.
     *
     * @throws CustomDimensionException with {@link ErrorCode#INVALID_SCOPE} for unknown values
     */
    @JsonCreator
    public static Scope validate(String value) {
        if (value != null) {
            for (Scope scope : values()) {
                if (scope.value.equals(value)) {
                    return scope;
                }
            }
        }
        String allowed = Arrays.stream(values()).map(Scope::value).collect(Collectors.joining(", "));
        throw new CustomDimensionException(
                ErrorCode.INVALID_SCOPE, "scope", "Invalid scope '" + value + "', allowed values are: " + allowed);
    }

    @Override
    public String toString() {
        return value;
    }
}
