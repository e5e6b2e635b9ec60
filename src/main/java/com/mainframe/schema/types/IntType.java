package com.mainframe.schema.types;

import com.mainframe.schema.exception.ConversionException;
import com.mainframe.schema.exception.FieldValidationException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.math.BigDecimal;
import java.util.List;

/**
 * Integer field. Numeric strings are parsed; fractional or out-of-range values are rejected.
 */
@Getter
public class IntType extends FieldType<Integer> {

    private final Integer minValue;
    private final Integer maxValue;

    public IntType() {
        this(false, null, null, null, null, null);
    }

    @Builder
    public IntType(boolean required, Integer defaultValue,
                   @Singular List<Integer> choices,
                   @Singular List<FieldValidator<Integer>> validators,
                   Integer minValue, Integer maxValue) {
        super(required, defaultValue, choices, validators);
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    @Override
    public Integer convert(Object raw) {
        if (raw instanceof Integer i) {
            return i;
        }
        if (raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).intValue();
        }
        try {
            if (raw instanceof Number number) {
                return new BigDecimal(number.toString()).intValueExact();
            }
            if (raw instanceof CharSequence text) {
                return new BigDecimal(text.toString().trim()).intValueExact();
            }
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ConversionException("Value '" + raw + "' is not a valid integer.");
        }
        throw new ConversionException("Value '" + raw + "' is not a valid integer.");
    }

    @Override
    public void validate(Integer value) {
        if (minValue != null && value < minValue) {
            throw new FieldValidationException("Int value should be greater than or equal to " + minValue + ".");
        }
        if (maxValue != null && value > maxValue) {
            throw new FieldValidationException("Int value should be less than or equal to " + maxValue + ".");
        }
        super.validate(value);
    }
}
