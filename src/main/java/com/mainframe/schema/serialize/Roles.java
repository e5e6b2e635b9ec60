package com.mainframe.schema.serialize;

import lombok.Value;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Factories and variants of {@link RoleFilter}.
 */
public final class Roles {

    private Roles() {
        // Utility class
    }

    /**
     * Emit only the named fields.
     */
    public static RoleFilter whitelist(String... fieldNames) {
        return new Whitelist(toSet(Arrays.asList(fieldNames)));
    }

    public static RoleFilter whitelist(Collection<String> fieldNames) {
        return new Whitelist(toSet(fieldNames));
    }

    /**
     * Emit every field except the named ones.
     */
    public static RoleFilter blacklist(String... fieldNames) {
        return new Blacklist(toSet(Arrays.asList(fieldNames)));
    }

    public static RoleFilter blacklist(Collection<String> fieldNames) {
        return new Blacklist(toSet(fieldNames));
    }

    /**
     * Emit every field.
     */
    public static RoleFilter wholelist() {
        return Wholelist.INSTANCE;
    }

    private static Set<String> toSet(Collection<String> fieldNames) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(fieldNames));
    }

    @Value
    public static class Whitelist implements RoleFilter {
        Set<String> fieldNames;

        @Override
        public boolean includes(String fieldName) {
            return fieldNames.contains(fieldName);
        }
    }

    @Value
    public static class Blacklist implements RoleFilter {
        Set<String> fieldNames;

        @Override
        public boolean includes(String fieldName) {
            return !fieldNames.contains(fieldName);
        }
    }

    public static final class Wholelist implements RoleFilter {
        static final Wholelist INSTANCE = new Wholelist();

        private Wholelist() {
        }

        @Override
        public boolean includes(String fieldName) {
            return true;
        }

        @Override
        public String toString() {
            return "Roles.Wholelist()";
        }
    }
}
