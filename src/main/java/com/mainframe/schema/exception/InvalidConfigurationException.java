package com.mainframe.schema.exception;

import java.util.List;

/**
 * Model declaration or options are malformed: unrecognized option keys,
 * wrongly typed option values, blank field names, or an undefined role.
 */
public class InvalidConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public InvalidConfigurationException(String error) {
        this(List.of(error));
    }

    public InvalidConfigurationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
