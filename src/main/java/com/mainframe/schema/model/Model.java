package com.mainframe.schema.model;

import com.mainframe.schema.exception.FieldNotSetException;
import com.mainframe.schema.exception.FieldValidationException;
import com.mainframe.schema.serialize.ModelSerializer;
import com.mainframe.schema.types.FieldType;
import com.mainframe.schema.validation.ValidationEngine;
import com.mainframe.schema.validation.ValidationMode;
import com.mainframe.schema.validation.ValidationResult;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One record of a {@link ModelDefinition}: the stored field values and the errors of
 * the last validation.
 *
 * <p>Only fields that were set carry an entry in {@link #getData()}; everything stored
 * there has passed its field type's conversion and validation. A failed conversion or
 * validation never replaces an existing value.</p>
 *
 * <p>Equality is structural over the stored values only. Instances are mutable and not
 * thread-safe; callers sharing one across threads must serialize access themselves.</p>
 */
public class Model {

    private static final Logger log = LoggerFactory.getLogger(Model.class);

    @Getter
    private final ModelDefinition definition;
    private final Map<String, Object> data;
    private final Map<String, List<String>> errors;

    Model(ModelDefinition definition) {
        this.definition = definition;
        this.data = new LinkedHashMap<>();
        this.errors = new LinkedHashMap<>();
        // defaults were checked when the definition was built
        definition.getFields().forEach((name, type) ->
                type.getDefault().ifPresent(value -> data.put(name, type.clean(value))));
    }

    private Model(Model source) {
        this.definition = source.definition;
        this.data = new LinkedHashMap<>(source.data);
        this.errors = new LinkedHashMap<>(source.errors);
    }

    public ModelOptions getOptions() {
        return definition.getOptions();
    }

    // ---- Read access ----

    public boolean contains(String fieldName) {
        return data.containsKey(fieldName);
    }

    public FieldSlot slot(String fieldName) {
        Object value = data.get(fieldName);
        return value != null ? FieldSlot.present(value) : FieldSlot.unset();
    }

    public Optional<Object> find(String fieldName) {
        return Optional.ofNullable(data.get(fieldName));
    }

    /**
     * @throws FieldNotSetException if the field has no stored value, or is not declared
     */
    public Object get(String fieldName) {
        Object value = data.get(fieldName);
        if (value == null) {
            throw new FieldNotSetException(definition.getName(), fieldName);
        }
        return value;
    }

    public <T> T get(String fieldName, Class<T> type) {
        return type.cast(get(fieldName));
    }

    /**
     * Read-only view of the stored values.
     */
    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    /**
     * Read-only view of the errors from the most recent validation, per field.
     */
    public Map<String, List<String>> getErrors() {
        return Collections.unmodifiableMap(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    // ---- Mutation ----

    /**
     * Cleans {@code raw} with the field's type and stores it. A null value unsets the field.
     *
     * @throws IllegalArgumentException  if the field is not declared
     * @throws FieldValidationException if the value is rejected; the old value is kept
     */
    public void set(String fieldName, Object raw) {
        FieldType<?> type = definition.getField(fieldName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown field '" + fieldName + "' on model " + definition.getName()));
        if (raw == null) {
            unset(fieldName);
            return;
        }
        Object value = type.clean(raw);
        data.put(fieldName, value);
        errors.remove(fieldName);
    }

    public void unset(String fieldName) {
        data.remove(fieldName);
    }

    // ---- Validation ----

    /**
     * Full validation of {@code input}.
     */
    public boolean validate(Map<String, ?> input) {
        return validate(input, ValidationMode.FULL);
    }

    public boolean validate(Map<String, ?> input, boolean partial) {
        return validate(input, partial ? ValidationMode.PARTIAL : ValidationMode.FULL);
    }

    /**
     * Converts and validates {@code input} against the declared fields, stores every
     * value that passed and replaces the errors of every field evaluated by this call.
     *
     * @return true if no field produced an error during this call
     */
    public boolean validate(Map<String, ?> input, ValidationMode mode) {
        ValidationResult result = ValidationEngine.validate(definition, data, input, mode);

        result.getEvaluatedFields().forEach(errors::remove);
        data.putAll(result.getAcceptedValues());
        result.getErrors().forEach((field, messages) -> errors.put(field, List.copyOf(messages)));

        if (!result.isValid()) {
            log.debug("{} validation of {} failed on {}", mode, definition.getName(), result.getErrors().keySet());
        }
        return result.isValid();
    }

    // ---- Serialization ----

    public Map<String, Object> serialize() {
        return ModelSerializer.serialize(this, null);
    }

    /**
     * @throws com.mainframe.schema.exception.InvalidConfigurationException if the role is not declared
     */
    public Map<String, Object> serialize(String role) {
        return ModelSerializer.serialize(this, role);
    }

    /**
     * Shallow copy: stored values (nested instances included) are shared with this instance.
     */
    public Model copy() {
        return new Model(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Model other)) {
            return false;
        }
        return data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return data.hashCode();
    }

    @Override
    public String toString() {
        return definition.getName() + data;
    }
}
