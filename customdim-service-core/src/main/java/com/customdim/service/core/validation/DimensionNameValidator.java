package com.customdim.service.core.validation;

import com.customdim.core.error.CustomDimensionException;
import com.customdim.core.error.ErrorCode;
import com.customdim.service.core.config.CustomDimensionsProperties;
import org.springframework.stereotype.Component;

@Component
public class DimensionNameValidator {

    private final int maxLength;

    public DimensionNameValidator(CustomDimensionsProperties properties) {
        this.maxLength = properties.getName().getMaxLength();
    }

    /**
     * Rejects blank names and names longer than the configured maximum.
     *
     * @return the name, trimmed
     */
    public String validate(String name) {
        if (name == null || name.isBlank()) {
            throw new CustomDimensionException(ErrorCode.INVALID_NAME, "name", "Name must not be empty");
        }
        String trimmed = name.trim();
        if (trimmed.length() > maxLength) {
            throw new CustomDimensionException(
                    ErrorCode.INVALID_NAME,
                    "name",
                    "Name is too long, maximum is " + maxLength + " characters but got " + trimmed.length());
        }
        return trimmed;
    }
}
