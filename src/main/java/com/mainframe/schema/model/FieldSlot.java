package com.mainframe.schema.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;

import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * State of one field on a model instance: either unset, or present with a value.
 * Stored values are never null, so "set to null" cannot be confused with "never set".
 */
@EqualsAndHashCode(doNotUseGetters = true)
@ToString(doNotUseGetters = true)
public final class FieldSlot {

    private static final FieldSlot UNSET = new FieldSlot(null);

    private final Object value;

    private FieldSlot(Object value) {
        this.value = value;
    }

    public static FieldSlot unset() {
        return UNSET;
    }

    public static FieldSlot present(@NonNull Object value) {
        return new FieldSlot(value);
    }

    public boolean isPresent() {
        return value != null;
    }

    public boolean isUnset() {
        return value == null;
    }

    /**
     * @throws NoSuchElementException if the slot is unset
     */
    public Object getValue() {
        if (value == null) {
            throw new NoSuchElementException("Field slot is unset");
        }
        return value;
    }

    public Optional<Object> toOptional() {
        return Optional.ofNullable(value);
    }
}
