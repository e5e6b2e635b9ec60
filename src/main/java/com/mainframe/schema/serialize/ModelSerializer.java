package com.mainframe.schema.serialize;

import com.mainframe.schema.model.Model;
import com.mainframe.schema.types.FieldType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a model instance into plain nested maps and lists, optionally through a role.
 *
 * Unset fields are left out. With a role, the owning definition must declare it and
 * its filter is applied to the full field map; nested models keep the role only when
 * their own definition declares it too.
 */
public final class ModelSerializer {

    private ModelSerializer() {
        // Utility class
    }

    public static Map<String, Object> serialize(Model model, String role) {
        RoleFilter filter = role != null ? model.getOptions().requireRole(role) : null;

        Map<String, Object> output = new LinkedHashMap<>();
        for (Map.Entry<String, FieldType<?>> entry : model.getDefinition().getFields().entrySet()) {
            String name = entry.getKey();
            model.find(name).ifPresent(value -> output.put(name, entry.getValue().export(value, role)));
        }

        return filter != null ? filter.apply(output) : output;
    }
}
