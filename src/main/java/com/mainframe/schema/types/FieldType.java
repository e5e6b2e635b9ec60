package com.mainframe.schema.types;

import com.mainframe.schema.exception.FieldValidationException;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * Conversion and validation policy for one model field.
 *
 * <p>A field type turns a raw, untyped input value into its typed form
 * ({@link #convert}) and checks that typed value ({@link #validate}). Both steps
 * signal failure by throwing a {@link FieldValidationException}; the owning model
 * records the messages under the field name.</p>
 *
 * <p>Instances are immutable and may be shared between model definitions.</p>
 *
 * @param <T> typed value produced by this field
 */
@Getter
public abstract class FieldType<T> {

    private final boolean required;

    @Getter(AccessLevel.NONE)
    private final T defaultValue;

    private final List<T> choices;

    private final List<FieldValidator<T>> validators;

    protected FieldType(boolean required, T defaultValue, List<T> choices, List<FieldValidator<T>> validators) {
        this.required = required;
        this.defaultValue = defaultValue;
        this.choices = choices == null ? List.of() : List.copyOf(choices);
        this.validators = validators == null ? List.of() : List.copyOf(validators);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    /**
     * Default value for instances that were not given one, if declared.
     */
    public Optional<T> getDefault() {
        return Optional.ofNullable(defaultValue).map(this::copyDefault);
    }

    /**
     * Hook for types whose values are mutable; the stored default is never handed out directly.
     */
    protected T copyDefault(T value) {
        return value;
    }

    /**
     * Coerces a non-null raw value to this field's type.
     *
     * @throws com.mainframe.schema.exception.ConversionException if the value cannot be coerced
     */
    public abstract T convert(Object raw);

    /**
     * Checks a converted value. Subclasses run their own constraints first and then call
     * {@code super.validate} for choices and custom validators.
     */
    public void validate(T value) {
        if (!choices.isEmpty() && !choices.contains(value)) {
            throw new FieldValidationException("Value must be one of " + choices + ".");
        }
        for (FieldValidator<T> validator : validators) {
            validator.validate(value);
        }
    }

    /**
     * Convert followed by validate.
     */
    public T clean(Object raw) {
        T value = convert(raw);
        validate(value);
        return value;
    }

    /**
     * Export form of a typed value: strings, numbers, booleans, lists and maps only.
     */
    public Object toPrimitive(T value, String role) {
        return value;
    }

    /**
     * Untyped entry point for callers holding a {@code FieldType<?>}. The value must have
     * been produced by this type's {@link #convert}.
     */
    @SuppressWarnings("unchecked")
    public Object export(Object value, String role) {
        if (value == null) {
            return null;
        }
        return toPrimitive((T) value, role);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + (required ? "(required)" : "");
    }
}
