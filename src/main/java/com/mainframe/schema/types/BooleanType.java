package com.mainframe.schema.types;

import com.mainframe.schema.exception.ConversionException;
import lombok.Builder;
import lombok.Singular;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Boolean field. Also understands the usual textual and 0/1 spellings.
 */
public class BooleanType extends FieldType<Boolean> {

    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "y", "1", "on");
    private static final Set<String> FALSE_VALUES = Set.of("false", "no", "n", "0", "off");

    public BooleanType() {
        this(false, null, null);
    }

    @Builder
    public BooleanType(boolean required, Boolean defaultValue,
                       @Singular List<FieldValidator<Boolean>> validators) {
        super(required, defaultValue, List.of(), validators);
    }

    @Override
    public Boolean convert(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            long number = ((Number) raw).longValue();
            if (number == 0 || number == 1) {
                return number == 1;
            }
        }
        if (raw instanceof CharSequence text) {
            String normalized = text.toString().trim().toLowerCase(Locale.ROOT);
            if (TRUE_VALUES.contains(normalized)) {
                return true;
            }
            if (FALSE_VALUES.contains(normalized)) {
                return false;
            }
        }
        throw new ConversionException("Value '" + raw + "' is not a valid boolean.");
    }
}
