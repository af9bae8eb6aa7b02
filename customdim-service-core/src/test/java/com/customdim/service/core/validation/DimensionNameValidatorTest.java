package com.customdim.service.core.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.customdim.core.error.CustomDimensionException;
import com.customdim.core.error.ErrorCode;
import com.customdim.service.core.config.CustomDimensionsProperties;
import org.junit.jupiter.api.Test;

class DimensionNameValidatorTest {

    private final DimensionNameValidator validator = new DimensionNameValidator(new CustomDimensionsProperties());

    @Test
    void trimsValidName() {
        assertThat(validator.validate("  Page Type ")).isEqualTo("Page Type");
    }

    @Test
    void rejectsEmptyAndBlankNames() {
        for (String name : new String[] {null, "", "   "}) {
            assertThatThrownBy(() -> validator.validate(name))
                    .isInstanceOf(CustomDimensionException.class)
                    .extracting(e -> ((CustomDimensionException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_NAME);
        }
    }

    @Test
    void rejectsNamesLongerThanConfiguredMaximum() {
        CustomDimensionsProperties properties = new CustomDimensionsProperties();
        properties.getName().setMaxLength(5);
        DimensionNameValidator shortNames = new DimensionNameValidator(properties);

        assertThat(shortNames.validate("12345")).isEqualTo("12345");
        assertThatThrownBy(() -> shortNames.validate("123456"))
                .isInstanceOf(CustomDimensionException.class)
                .hasMessageContaining("too long")
                .extracting(e -> ((CustomDimensionException) e).getField())
                .isEqualTo("name");
    }
}
