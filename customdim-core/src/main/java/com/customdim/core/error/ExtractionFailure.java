package com.customdim.core.error;

/** Sub-reason attached to {@link ErrorCode#INVALID_EXTRACTION}. */
public enum ExtractionFailure {
    UNSUPPORTED_SOURCE,
    MALFORMED_PATTERN,
    CAPTURE_GROUP_COUNT,
    TOO_MANY_RULES
}
