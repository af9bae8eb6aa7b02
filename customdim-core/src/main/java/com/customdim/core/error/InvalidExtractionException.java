package com.customdim.core.error;

/** Extraction rule validation failure with the offending rule position. */
public class InvalidExtractionException extends CustomDimensionException {

    private final ExtractionFailure reason;
    private final int ruleIndex;

    public InvalidExtractionException(ExtractionFailure reason, int ruleIndex, String field, String message) {
        super(ErrorCode.INVALID_EXTRACTION, field, message);
        this.reason = reason;
        this.ruleIndex = ruleIndex;
    }

    public ExtractionFailure getReason() {
        return reason;
    }

    /** Zero-based position of the rule in the submitted list, or -1 for list-level failures. */
    public int getRuleIndex() {
        return ruleIndex;
    }
}
