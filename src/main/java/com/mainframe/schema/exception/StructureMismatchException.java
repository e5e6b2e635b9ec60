package com.mainframe.schema.exception;

import java.util.List;

/**
 * The raw value has the wrong shape, e.g. a list where a mapping is expected.
 */
public class StructureMismatchException extends FieldValidationException {

    private static final long serialVersionUID = 1L;

    public StructureMismatchException(String message) {
        super(message);
    }

    public StructureMismatchException(List<String> messages) {
        super(messages);
    }
}
