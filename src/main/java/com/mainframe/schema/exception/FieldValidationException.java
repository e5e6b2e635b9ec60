package com.mainframe.schema.exception;

import java.util.List;

/**
 * Field-level failure raised by a field type while converting or validating a value.
 *
 * Holds every message produced for the field so the owning model can record them
 * under the field name in one go.
 */
public class FieldValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> messages;

    public FieldValidationException(String message) {
        this(List.of(message));
    }

    public FieldValidationException(List<String> messages) {
        super(String.join(System.lineSeparator(), messages));
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("At least one message is required");
        }
        this.messages = List.copyOf(messages);
    }

    public List<String> getMessages() {
        return messages;
    }
}
