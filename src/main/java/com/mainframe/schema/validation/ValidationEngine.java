package com.mainframe.schema.validation;

import com.mainframe.schema.exception.FieldValidationException;
import com.mainframe.schema.exception.RequiredFieldException;
import com.mainframe.schema.model.ModelDefinition;
import com.mainframe.schema.types.FieldType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts and validates raw input against a model definition.
 *
 * Fields are visited in registry order. For each one the candidate value is the
 * input value when present and non-null, otherwise the stored value, otherwise (full
 * mode only) the declared default. In partial mode a field with no input value is
 * skipped entirely. In full mode a required field without any candidate is reported
 * as missing; an explicit null in the input clears the stored value as a candidate
 * but never removes it from the instance. Field failures are collected; they never
 * abort the remaining fields.
 *
 * The engine does not touch the instance; the caller applies the returned result.
 */
public final class ValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    private ValidationEngine() {
        // Utility class
    }

    public static ValidationResult validate(ModelDefinition definition,
                                            Map<String, ?> current,
                                            Map<String, ?> input,
                                            ValidationMode mode) {
        Map<String, ?> supplied = input != null ? input : Map.of();
        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();

        for (Map.Entry<String, FieldType<?>> entry : definition.getFields().entrySet()) {
            String name = entry.getKey();
            FieldType<?> type = entry.getValue();

            Object raw = supplied.get(name);
            if (raw != null) {
                clean(name, type, raw, result);
                continue;
            }
            if (mode == ValidationMode.PARTIAL) {
                continue;
            }

            result.evaluatedField(name);
            boolean explicitNull = supplied.containsKey(name);
            if (!explicitNull && current.containsKey(name)) {
                continue;
            }
            Optional<?> defaultValue = type.getDefault();
            if (defaultValue.isPresent() && !explicitNull) {
                clean(name, type, defaultValue.get(), result);
            } else if (type.isRequired()) {
                result.error(name, List.of(RequiredFieldException.MESSAGE));
            }
        }

        ValidationResult outcome = result.build();
        log.debug("{} validation of {}: accepted {}, rejected {}",
                mode, definition.getName(), outcome.getAcceptedValues().keySet(), outcome.getErrors().keySet());
        return outcome;
    }

    private static void clean(String name, FieldType<?> type, Object raw,
                              ValidationResult.ValidationResultBuilder result) {
        result.evaluatedField(name);
        try {
            result.acceptedValue(name, type.clean(raw));
        } catch (FieldValidationException e) {
            log.debug("Field '{}' rejected value {}: {}", name, raw, e.getMessages());
            result.error(name, e.getMessages());
        }
    }
}
