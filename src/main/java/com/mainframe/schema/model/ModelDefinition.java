package com.mainframe.schema.model;

import com.mainframe.schema.exception.FieldValidationException;
import com.mainframe.schema.exception.InvalidConfigurationException;
import com.mainframe.schema.exception.ModelValidationException;
import com.mainframe.schema.types.FieldType;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compiled schema of one named model: the ordered field registry and its options.
 *
 * <p>Built once, immutable afterwards, and safe to share between threads. Parent
 * definitions are merged into the registry first (the first-listed parent is the
 * nearest and wins over later ones), then this definition's own fields; a field
 * redeclared here replaces the inherited entry in place.</p>
 *
 * <pre>{@code
 * ModelDefinition user = ModelDefinition.builder()
 *         .name("User")
 *         .field("name", StringType.builder().required(true).build())
 *         .field("bio", new StringType())
 *         .options(ModelOptions.builder().roles(Map.of("public", Roles.whitelist("name"))).build())
 *         .build();
 * }</pre>
 */
@Getter
public class ModelDefinition {

    private static final Logger log = LoggerFactory.getLogger(ModelDefinition.class);

    private final String name;

    /**
     * Direct parents, nearest first.
     */
    private final List<ModelDefinition> parents;

    /**
     * Fields declared on this definition only.
     */
    private final Map<String, FieldType<?>> declaredFields;

    /**
     * Merged registry, inherited fields included, in declaration order.
     */
    private final Map<String, FieldType<?>> fields;

    /**
     * Options bound to this definition; {@code options.getKlass() == this}.
     */
    private final ModelOptions options;

    @Builder
    private ModelDefinition(@NonNull String name,
                            @Singular List<ModelDefinition> parents,
                            @Singular Map<String, FieldType<?>> fields,
                            ModelOptions options) {
        List<String> errors = new ArrayList<>();
        fields.forEach((fieldName, type) -> {
            if (fieldName == null || fieldName.isBlank()) {
                errors.add("Model " + name + " declares a field with a blank name");
            } else if (type == null) {
                errors.add("Field '" + fieldName + "' on model " + name + " has no type");
            } else {
                checkDefault(name, fieldName, type, errors);
            }
        });
        if (!errors.isEmpty()) {
            log.warn("Rejected model definition {}: {}", name, errors);
            throw new InvalidConfigurationException(errors);
        }

        this.name = name;
        this.parents = List.copyOf(parents);
        this.declaredFields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.fields = Collections.unmodifiableMap(mergeRegistry(this.parents, fields));
        this.options = (options != null ? options : ModelOptions.defaults()).toBuilder()
                .klass(this)
                .build();

        log.debug("Built model definition {} with fields {} (parents: {})",
                name, this.fields.keySet(), this.parents.stream().map(ModelDefinition::getName).toList());
    }

    private static void checkDefault(String modelName, String fieldName, FieldType<?> type, List<String> errors) {
        type.getDefault().ifPresent(value -> {
            try {
                type.clean(value);
            } catch (FieldValidationException e) {
                errors.add("Default of field '" + fieldName + "' on model " + modelName + " is invalid: "
                        + String.join(" ", e.getMessages()));
            }
        });
    }

    private static Map<String, FieldType<?>> mergeRegistry(List<ModelDefinition> parents,
                                                           Map<String, FieldType<?>> ownFields) {
        Map<String, FieldType<?>> merged = new LinkedHashMap<>();
        for (int i = parents.size() - 1; i >= 0; i--) {
            merged.putAll(parents.get(i).getFields());
        }
        merged.putAll(ownFields);
        return merged;
    }

    public Optional<FieldType<?>> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    public List<String> getFieldNames() {
        return List.copyOf(fields.keySet());
    }

    /**
     * True if this definition is {@code other} or inherits from it, directly or not.
     */
    public boolean isSubtypeOf(ModelDefinition other) {
        if (this == other) {
            return true;
        }
        for (ModelDefinition parent : parents) {
            if (parent.isSubtypeOf(other)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Empty instance with declared defaults stored. Required fields are not enforced.
     */
    public Model newInstance() {
        return new Model(this);
    }

    /**
     * Instance populated from {@code values}. Defaults are stored first, then the values
     * go through full validation; unknown keys are ignored.
     *
     * @throws ModelValidationException listing every failing field, including each
     *                                  required field left without a value
     */
    public Model newInstance(Map<String, ?> values) {
        Model instance = new Model(this);
        if (values == null || values.isEmpty()) {
            return instance;
        }
        if (!instance.validate(values)) {
            log.debug("Construction of {} failed: {}", name, instance.getErrors());
            throw new ModelValidationException(name, instance.getErrors());
        }
        return instance;
    }

    @Override
    public String toString() {
        return "ModelDefinition(" + name + ", fields=" + fields.keySet() + ")";
    }
}
