package com.ufilename.core.policy;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serialized form of a policy: a JSON-compatible map with a mandatory
 * {@code type} tag plus policy-specific fields.
 *
 * <p>Instances are immutable and keep key insertion order, so writing a config
 * back out reproduces the field order the policy declared.  Nested maps and
 * lists (the composite's {@code policies}) are frozen as plain maps and lists,
 * which keeps {@link #asMap()} directly consumable by Jackson.
 *
 * <p>The typed readers apply the field's default when the key is missing or
 * null and raise {@link NamingException.Kind#INVALID_CONFIG} when a value
 * cannot be coerced.
 */
public final class PolicyConfig {

    public static final String TYPE = "type";

    private final Map<String, Object> values;

    private PolicyConfig(Map<String, Object> values) {
        this.values = values;
    }

    public static PolicyConfig of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        return new PolicyConfig(freezeMap(values));
    }

    public static Builder builder(String type) {
        return new Builder().put(TYPE, type);
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    /** The type tag, or null when missing. */
    public String type() {
        Object raw = values.get(TYPE);
        return raw == null ? null : raw.toString();
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public String getString(String key, String defaultValue) {
        Object raw = values.get(key);
        return raw == null ? defaultValue : String.valueOf(raw);
    }

    public int getInt(String key, int defaultValue) {
        Object raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return toIntExact(key, ((Number) raw).longValue());
        }
        if (raw instanceof Number n) {
            if ((n instanceof Double d && !Double.isFinite(d)) || (n instanceof Float f && !Float.isFinite(f))) {
                throw invalid(key, raw, "an integer");
            }
            try {
                return new BigDecimal(n.toString()).intValueExact();
            } catch (ArithmeticException e) {
                throw invalid(key, raw, "an integer");
            }
        }
        if (raw instanceof String s) {
            try {
                return Integer.parseInt(s.strip());
            } catch (NumberFormatException e) {
                throw new NamingException(NamingException.Kind.INVALID_CONFIG,
                        "Field '%s' must be an integer, got \"%s\"".formatted(key, s), e);
            }
        }
        throw invalid(key, raw, "an integer");
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof String s) {
            if ("true".equalsIgnoreCase(s.strip()))  return true;
            if ("false".equalsIgnoreCase(s.strip())) return false;
        }
        throw invalid(key, raw, "a boolean");
    }

    /** Nested configs under {@code key}; empty when the key is missing. */
    public List<PolicyConfig> getConfigList(String key) {
        Object raw = values.get(key);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw invalid(key, raw, "a list of policy configs");
        }
        List<PolicyConfig> configs = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                throw invalid(key, item, "a list of policy configs");
            }
            configs.add(new PolicyConfig(freezeMap(map)));
        }
        return List.copyOf(configs);
    }

    /** Unmodifiable view; nested configs appear as plain maps. */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PolicyConfig other && values.equals(other.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String key, Object value) {
            values.put(key, value);
            return this;
        }

        public Builder putConfigs(String key, List<PolicyConfig> configs) {
            values.put(key, configs.stream().map(PolicyConfig::asMap).toList());
            return this;
        }

        public PolicyConfig build() {
            return PolicyConfig.of(values);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), freeze(v)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof PolicyConfig config) {
            return config.values;
        }
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(freeze(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static int toIntExact(String key, long value) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new NamingException(NamingException.Kind.INVALID_CONFIG,
                    "Field '%s' is out of range: %d".formatted(key, value));
        }
        return (int) value;
    }

    private static NamingException invalid(String key, Object raw, String expected) {
        return new NamingException(NamingException.Kind.INVALID_CONFIG,
                "Field '%s' must be %s, got %s (%s)".formatted(
                        key, expected, raw, raw.getClass().getSimpleName()));
    }
}
