package com.mainframe.schema.exception;

/**
 * A required field has no value.
 */
public class RequiredFieldException extends FieldValidationException {

    private static final long serialVersionUID = 1L;

    public static final String MESSAGE = "This field is required.";

    public RequiredFieldException() {
        super(MESSAGE);
    }
}
