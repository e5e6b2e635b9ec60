package com.mainframe.schema.model;

import com.mainframe.schema.exception.InvalidConfigurationException;
import com.mainframe.schema.serialize.RoleFilter;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-definition configuration: the owning definition ({@code klass}), the named
 * serialization roles and a free-form namespace tag.
 *
 * <p>{@code roles} is {@code null} when no roles block was declared, which is kept
 * distinct from an empty roles block.</p>
 */
@Value
public class ModelOptions {

    private static final Logger log = LoggerFactory.getLogger(ModelOptions.class);

    public static final String KLASS = "klass";
    public static final String ROLES = "roles";
    public static final String NAMESPACE = "namespace";

    /**
     * The only keys a configuration block may contain.
     */
    public static final Set<String> RECOGNIZED_KEYS = Set.of(KLASS, ROLES, NAMESPACE);

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    ModelDefinition klass;

    Map<String, RoleFilter> roles;

    String namespace;

    @Builder(toBuilder = true)
    private ModelOptions(ModelDefinition klass, Map<String, RoleFilter> roles, String namespace) {
        this.klass = klass;
        this.roles = roles != null ? Collections.unmodifiableMap(new LinkedHashMap<>(roles)) : null;
        this.namespace = namespace;
    }

    public static ModelOptions defaults() {
        return builder().build();
    }

    /**
     * Reads a declared configuration block. Every unrecognized key and every wrongly
     * typed value is reported in a single {@link InvalidConfigurationException}.
     */
    public static ModelOptions fromMap(Map<String, ?> config) {
        if (config == null || config.isEmpty()) {
            return defaults();
        }

        List<String> errors = new ArrayList<>();
        for (String key : config.keySet()) {
            if (!RECOGNIZED_KEYS.contains(key)) {
                errors.add("Unrecognized option '" + key + "'. Allowed options: " + new TreeSet<>(RECOGNIZED_KEYS));
            }
        }

        Object klass = config.get(KLASS);
        if (klass != null && !(klass instanceof ModelDefinition)) {
            errors.add("Option 'klass' must be a ModelDefinition, got " + klass.getClass().getSimpleName());
        }

        Object namespace = config.get(NAMESPACE);
        if (namespace != null && !(namespace instanceof String)) {
            errors.add("Option 'namespace' must be a string, got " + namespace.getClass().getSimpleName());
        }

        Map<String, RoleFilter> roles = readRoles(config.get(ROLES), errors);

        if (!errors.isEmpty()) {
            log.warn("Rejected model options {}: {}", config.keySet(), errors);
            throw new InvalidConfigurationException(errors);
        }

        return builder()
                .klass((ModelDefinition) klass)
                .roles(roles)
                .namespace((String) namespace)
                .build();
    }

    public boolean hasRole(String name) {
        return roles != null && roles.containsKey(name);
    }

    public Optional<RoleFilter> findRole(String name) {
        return roles == null ? Optional.empty() : Optional.ofNullable(roles.get(name));
    }

    /**
     * @throws InvalidConfigurationException if no role with this name is declared
     */
    public RoleFilter requireRole(String name) {
        return findRole(name).orElseThrow(() -> new InvalidConfigurationException(
                "Role '" + name + "' is not defined for model " + (klass != null ? klass.getName() : "<unbound>")));
    }

    private static Map<String, RoleFilter> readRoles(Object raw, List<String> errors) {
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            errors.add("Option 'roles' must be a mapping of role name to RoleFilter, got "
                    + raw.getClass().getSimpleName());
            return null;
        }
        Map<String, RoleFilter> roles = new LinkedHashMap<>();
        map.forEach((name, filter) -> {
            if (!(name instanceof String roleName)) {
                errors.add("Role names must be strings, got " + name);
            } else if (!(filter instanceof RoleFilter roleFilter)) {
                errors.add("Role '" + roleName + "' must map to a RoleFilter");
            } else {
                roles.put(roleName, roleFilter);
            }
        });
        return roles;
    }
}
