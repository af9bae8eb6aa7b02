package com.customdim.core.error;

/**
 * Stable error kinds surfaced to API consumers. The wire {@link #code()} never changes once
 * published; clients branch on it.
 */
public enum ErrorCode {
    INVALID_SCOPE("custom-dimensions.invalid-scope", 400),
    INVALID_NAME("custom-dimensions.invalid-name", 400),
    INVALID_ACTIVE_FLAG("custom-dimensions.invalid-active-flag", 400),
    INVALID_EXTRACTION("custom-dimensions.invalid-extraction", 400),
    NO_SLOTS_AVAILABLE("custom-dimensions.no-slots-available", 409),
    NOT_FOUND("custom-dimensions.not-found", 404),
    INACTIVE("custom-dimensions.inactive", 409),
    UNAUTHORIZED("custom-dimensions.unauthorized", 403),
    PERSISTENCE_FAILURE("custom-dimensions.persistence-failure", 503);

    private final String code;
    private final int httpStatus;

    ErrorCode(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
