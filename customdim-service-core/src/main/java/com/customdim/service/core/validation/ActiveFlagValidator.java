package com.customdim.service.core.validation;

import com.customdim.core.error.CustomDimensionException;
import com.customdim.core.error.ErrorCode;
import org.springframework.stereotype.Component;

/** Parses 0/1 style flags as they arrive from API callers. */
@Component
public class ActiveFlagValidator {

    public boolean validate(Object value) {
        return validate(value, "active");
    }

    public boolean validate(Object value, String field) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            long l = n.longValue();
            if (l == n.doubleValue() && (l == 0L || l == 1L)) {
                return l == 1L;
            }
        } else if (value instanceof String s) {
            switch (s.trim()) {
                case "1", "true":
                    return true;
                case "0", "false":
                    return false;
                default:
                    break;
            }
        }
        throw new CustomDimensionException(
                ErrorCode.INVALID_ACTIVE_FLAG, field, "Invalid value '" + value + "' for " + field + ", expected 0 or 1");
    }
}
