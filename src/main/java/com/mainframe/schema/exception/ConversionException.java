package com.mainframe.schema.exception;

import java.util.List;

/**
 * Raw value cannot be coerced to the field's type.
 */
public class ConversionException extends FieldValidationException {

    private static final long serialVersionUID = 1L;

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(List<String> messages) {
        super(messages);
    }
}
