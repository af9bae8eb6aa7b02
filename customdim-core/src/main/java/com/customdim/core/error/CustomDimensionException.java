package com.customdim.core.error;

/**
 * Failure raised by the custom dimension configuration core. Carries an {@link ErrorCode} and,
 * for validation failures, the name of the offending field.
 */
public class CustomDimensionException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String field;

    public CustomDimensionException(ErrorCode errorCode, String message) {
        this(errorCode, null, message, null);
    }

    public CustomDimensionException(ErrorCode errorCode, String field, String message) {
        this(errorCode, field, message, null);
    }

    public CustomDimensionException(ErrorCode errorCode, String field, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.field = field;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /** Request field that failed validation, or {@code null} when the error is not field specific. */
    public String getField() {
        return field;
    }

    public static CustomDimensionException notFound(long idDimension, int idSite) {
        return new CustomDimensionException(
                ErrorCode.NOT_FOUND,
                "idDimension",
                "Custom dimension " + idDimension + " does not exist for site " + idSite);
    }

    public static CustomDimensionException inactive(long idDimension, int idSite) {
        return new CustomDimensionException(
                ErrorCode.INACTIVE,
                "idDimension",
                "Custom dimension " + idDimension + " is not active for site " + idSite);
    }

    public static CustomDimensionException persistenceFailure(String message, Throwable cause) {
        return new CustomDimensionException(ErrorCode.PERSISTENCE_FAILURE, null, message, cause);
    }
}
