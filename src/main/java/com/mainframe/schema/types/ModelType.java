package com.mainframe.schema.types;

import com.mainframe.schema.exception.StructureMismatchException;
import com.mainframe.schema.model.Model;
import com.mainframe.schema.model.ModelDefinition;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field holding a nested model instance.
 *
 * A mapping is turned into a fresh instance of the wrapped definition and fully
 * validated; a given instance is copied and fully validated the same way. Nested
 * errors are reported on the outer field as a structural failure, one
 * {@code "<nestedField>: <message>"} line per nested message.
 */
@Getter
public class ModelType extends FieldType<Model> {

    private final ModelDefinition model;

    public ModelType(ModelDefinition model) {
        this(model, false, null, null);
    }

    @Builder
    public ModelType(@NonNull ModelDefinition model, boolean required, Model defaultValue,
                     @Singular List<FieldValidator<Model>> validators) {
        super(required, defaultValue, List.of(), validators);
        this.model = model;
    }

    @Override
    protected Model copyDefault(Model value) {
        return value.copy();
    }

    @Override
    public Model convert(Object raw) {
        Model instance;
        Map<String, Object> input;
        if (raw instanceof Model given) {
            if (!given.getDefinition().isSubtypeOf(model)) {
                throw new StructureMismatchException("Expected a " + model.getName() + " instance, got "
                        + given.getDefinition().getName() + ".");
            }
            instance = given.copy();
            input = Map.of();
        } else if (raw instanceof Map<?, ?> map) {
            instance = model.newInstance();
            input = withStringKeys(map);
        } else {
            throw new StructureMismatchException("Please use a mapping for this field.");
        }

        // full validation, so a leniently built instance cannot skip its required fields
        if (!instance.validate(input)) {
            List<String> messages = new ArrayList<>();
            instance.getErrors().forEach((field, errors) -> errors.forEach(e -> messages.add(field + ": " + e)));
            throw new StructureMismatchException(messages);
        }
        return instance;
    }

    /**
     * Nested models keep the requested role only if their own definition declares it.
     */
    @Override
    public Object toPrimitive(Model value, String role) {
        if (role != null && value.getOptions().hasRole(role)) {
            return value.serialize(role);
        }
        return value.serialize();
    }

    private static Map<String, Object> withStringKeys(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }

    @Override
    public String toString() {
        return "ModelType<" + model.getName() + ">" + (isRequired() ? "(required)" : "");
    }
}
