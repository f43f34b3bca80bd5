package io.callflow.core.flow;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/// Read-only view over a node's open key-value configuration.
///
/// Editor configs are loosely typed: the same setting may live under several keys
/// (`phoneNumber`, `transferNumber`, `number`) and values arrive as whatever the JSON
/// held. Lookups here take the keys in priority order and return the first
/// *present* value, where an empty string counts as absent.
///
/// @implNote Immutable and thread-safe as long as the wrapped map is not mutated.
public final class NodeConfig {

    private static final NodeConfig EMPTY = new NodeConfig(Map.of());

    private final Map<String, Object> values;

    private NodeConfig(Map<String, Object> values) {
        this.values = values;
    }

    /// Wraps a configuration map.
    ///
    /// @param values raw configuration, may be null
    /// @return config view, never null
    public static NodeConfig of(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new NodeConfig(Collections.unmodifiableMap(values));
    }

    /// Returns an empty configuration.
    ///
    /// @return shared empty config, never null
    public static NodeConfig empty() {
        return EMPTY;
    }

    /// Returns the first non-empty text value among the given keys.
    ///
    /// Strings are returned as-is; numbers are converted with `toString()` so that
    /// numeric phone numbers or ids survive. Other value types are skipped.
    ///
    /// @param keys lookup keys in priority order, not null
    /// @return first non-empty value, or null if none of the keys holds one
    public String text(String... keys) {
        for (String key : keys) {
            Object value = values.get(key);
            if (value instanceof String s && !s.isEmpty()) {
                return s;
            }
            if (value instanceof Number n) {
                return n.toString();
            }
        }
        return null;
    }

    /// Returns the first non-empty text value among the given keys, or a default.
    ///
    /// @param defaultValue fallback when no key holds text, may be null
    /// @param keys lookup keys in priority order, not null
    /// @return resolved text or `defaultValue`
    public String textOr(String defaultValue, String... keys) {
        String value = text(keys);
        return value != null ? value : defaultValue;
    }

    /// Returns a boolean setting if the key holds an actual boolean.
    ///
    /// @param key lookup key, not null
    /// @return the boolean value, or null when absent or not a boolean
    public Boolean flag(String key) {
        return values.get(key) instanceof Boolean b ? b : null;
    }

    /// Returns a boolean setting with a default for absent or non-boolean values.
    ///
    /// @param key lookup key, not null
    /// @param defaultValue value used when the key holds no boolean
    /// @return resolved boolean
    public boolean flagOr(String key, boolean defaultValue) {
        Boolean value = flag(key);
        return value != null ? value : defaultValue;
    }

    /// Returns the first positive integer among the given keys, or a default.
    ///
    /// Numeric strings are parsed after trimming; zero, negatives and unparseable strings
    /// count as absent.
    ///
    /// @param defaultValue fallback value
    /// @param keys lookup keys in priority order, not null
    /// @return resolved integer
    public long numberOr(long defaultValue, String... keys) {
        for (String key : keys) {
            Object value = values.get(key);
            long parsed = 0;
            if (value instanceof Number n) {
                parsed = n.longValue();
            } else if (value instanceof String s && !s.isEmpty()) {
                try {
                    parsed = Long.parseLong(s.trim());
                } catch (NumberFormatException e) {
                    parsed = 0;
                }
            }
            if (parsed > 0) {
                return parsed;
            }
        }
        return defaultValue;
    }

    /// Returns a nested map value.
    ///
    /// @param key lookup key, not null
    /// @return nested map, or null when absent or not a map
    @SuppressWarnings("unchecked")
    public Map<String, Object> map(String key) {
        return values.get(key) instanceof Map<?, ?> m ? (Map<String, Object>) m : null;
    }

    /// Returns a list value.
    ///
    /// @param key lookup key, not null
    /// @return list, or an empty list when absent or not a list
    public List<?> list(String key) {
        return values.get(key) instanceof List<?> l ? l : List.of();
    }

    /// Returns the raw value stored under a key.
    ///
    /// @param key lookup key, not null
    /// @return raw value, may be null
    public Object raw(String key) {
        return values.get(key);
    }

    /// Returns the wrapped values.
    ///
    /// @return unmodifiable configuration map, never null
    public Map<String, Object> asMap() {
        return values;
    }
}
