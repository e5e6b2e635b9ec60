package com.mainframe.schema.types;

import com.mainframe.schema.exception.FieldValidationException;

/**
 * User-supplied check attached to a field type. Runs after the type's own
 * constraints and signals failure by throwing.
 */
@FunctionalInterface
public interface FieldValidator<T> {

    void validate(T value) throws FieldValidationException;
}
