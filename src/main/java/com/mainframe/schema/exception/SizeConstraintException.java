package com.mainframe.schema.exception;

/**
 * A list value has fewer or more items than its field allows.
 */
public class SizeConstraintException extends FieldValidationException {

    private static final long serialVersionUID = 1L;

    public SizeConstraintException(String message) {
        super(message);
    }
}
