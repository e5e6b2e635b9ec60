package com.mainframe.schema.serialize;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named allow/deny rule over field names, applied to a model's serialized output.
 *
 * @see Roles
 */
public interface RoleFilter {

    boolean includes(String fieldName);

    /**
     * Keeps the entries whose field name this filter includes, in their original order.
     */
    default Map<String, Object> apply(Map<String, Object> values) {
        Map<String, Object> filtered = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            if (includes(name)) {
                filtered.put(name, value);
            }
        });
        return filtered;
    }
}
