package com.mainframe.schema.types;

import com.mainframe.schema.exception.ConversionException;
import com.mainframe.schema.exception.FieldValidationException;
import com.mainframe.schema.model.Model;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Text field. Accepts strings and scalar values that have an obvious text form.
 */
@Getter
public class StringType extends FieldType<String> {

    private final Integer minLength;
    private final Integer maxLength;
    private final Pattern regex;

    public StringType() {
        this(false, null, null, null, null, null, null);
    }

    @Builder
    public StringType(boolean required, String defaultValue,
                      @Singular List<String> choices,
                      @Singular List<FieldValidator<String>> validators,
                      Integer minLength, Integer maxLength, String regex) {
        super(required, defaultValue, choices, validators);
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.regex = regex != null ? Pattern.compile(regex) : null;
    }

    @Override
    public String convert(Object raw) {
        if (raw instanceof CharSequence text) {
            return text.toString();
        }
        if (raw instanceof Map || raw instanceof Collection || raw.getClass().isArray()
                || raw instanceof Model) {
            throw new ConversionException("Couldn't interpret value as string.");
        }
        return raw.toString();
    }

    @Override
    public void validate(String value) {
        if (minLength != null && value.length() < minLength) {
            throw new FieldValidationException("String value is too short.");
        }
        if (maxLength != null && value.length() > maxLength) {
            throw new FieldValidationException("String value is too long.");
        }
        if (regex != null && !regex.matcher(value).matches()) {
            throw new FieldValidationException("String value did not match validation regex.");
        }
        super.validate(value);
    }
}
