package com.mainframe.schema.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thrown when a model instance cannot be constructed from the supplied values.
 *
 * Carries the complete error map (field name to messages), so every missing
 * required field is reported at once rather than one per attempt.
 */
public class ModelValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String modelName;
    private final Map<String, List<String>> errors;

    public ModelValidationException(String modelName, Map<String, List<String>> errors) {
        super(describe(modelName, errors));
        this.modelName = modelName;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        errors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
        this.errors = Collections.unmodifiableMap(copy);
    }

    public String getModelName() {
        return modelName;
    }

    public Map<String, List<String>> getErrors() {
        return errors;
    }

    public List<String> getFieldNames() {
        return new ArrayList<>(errors.keySet());
    }

    private static String describe(String modelName, Map<String, List<String>> errors) {
        List<String> lines = new ArrayList<>();
        lines.add("Invalid values for model " + modelName + ":");
        errors.forEach((field, messages) -> messages.forEach(m -> lines.add("  " + field + ": " + m)));
        return String.join(System.lineSeparator(), lines);
    }
}
