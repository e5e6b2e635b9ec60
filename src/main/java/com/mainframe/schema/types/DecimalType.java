package com.mainframe.schema.types;

import com.mainframe.schema.exception.ConversionException;
import com.mainframe.schema.exception.FieldValidationException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.math.BigDecimal;
import java.util.List;

/**
 * Arbitrary-precision decimal field.
 */
@Getter
public class DecimalType extends FieldType<BigDecimal> {

    private final BigDecimal minValue;
    private final BigDecimal maxValue;

    public DecimalType() {
        this(false, null, null, null, null, null);
    }

    @Builder
    public DecimalType(boolean required, BigDecimal defaultValue,
                       @Singular List<BigDecimal> choices,
                       @Singular List<FieldValidator<BigDecimal>> validators,
                       BigDecimal minValue, BigDecimal maxValue) {
        super(required, defaultValue, choices, validators);
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    @Override
    public BigDecimal convert(Object raw) {
        if (raw instanceof BigDecimal decimal) {
            return decimal;
        }
        if (raw instanceof Number || raw instanceof CharSequence) {
            String text = raw.toString().trim();
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                throw new ConversionException("Value '" + raw + "' is not a valid decimal.");
            }
        }
        throw new ConversionException("Value '" + raw + "' is not a valid decimal.");
    }

    @Override
    public void validate(BigDecimal value) {
        if (minValue != null && value.compareTo(minValue) < 0) {
            throw new FieldValidationException("Decimal value should be greater than or equal to " + minValue + ".");
        }
        if (maxValue != null && value.compareTo(maxValue) > 0) {
            throw new FieldValidationException("Decimal value should be less than or equal to " + maxValue + ".");
        }
        super.validate(value);
    }
}
