package com.mainframe.schema.exception;

import java.util.NoSuchElementException;

/**
 * Read of a field that has no stored value on the instance.
 */
public class FieldNotSetException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;
    private final String fieldName;

    public FieldNotSetException(String modelName, String fieldName) {
        super("Field '" + fieldName + "' is not set on model " + modelName);
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
