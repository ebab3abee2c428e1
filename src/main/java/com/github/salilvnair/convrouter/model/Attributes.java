package com.github.salilvnair.convrouter.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, insertion-ordered string-keyed map of {@link AttributeValue}s.
 * Every mutator returns a new instance.
 */
public final class Attributes {

    private static final Attributes EMPTY = new Attributes(Map.of());

    private final Map<String, AttributeValue> values;

    private Attributes(Map<String, AttributeValue> values) {
        this.values = values;
    }

    public static Attributes empty() {
        return EMPTY;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Attributes fromMap(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, AttributeValue> copy = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, AttributeValue.of(v));
            }
        });
        return new Attributes(Collections.unmodifiableMap(copy));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Attributes with(String key, AttributeValue value) {
        if (key == null || value == null) {
            return this;
        }
        Map<String, AttributeValue> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new Attributes(Collections.unmodifiableMap(copy));
    }

    public Attributes with(String key, String value) {
        return value == null ? this : with(key, new AttributeValue.Text(value));
    }

    public Attributes with(String key, double value) {
        return with(key, new AttributeValue.Numeric(value));
    }

    public Attributes with(String key, boolean value) {
        return with(key, new AttributeValue.Flag(value));
    }

    public Attributes with(String key, List<String> value) {
        return value == null ? this : with(key, new AttributeValue.TextList(value));
    }

    public Attributes without(String key) {
        if (!values.containsKey(key)) {
            return this;
        }
        Map<String, AttributeValue> copy = new LinkedHashMap<>(values);
        copy.remove(key);
        return new Attributes(Collections.unmodifiableMap(copy));
    }

    /**
     * Last-write-wins merge: keys of {@code other} replace keys of this instance.
     */
    public Attributes merge(Attributes other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Map<String, AttributeValue> copy = new LinkedHashMap<>(values);
        copy.putAll(other.values);
        return new Attributes(Collections.unmodifiableMap(copy));
    }

    public Optional<AttributeValue> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<String> getText(String key) {
        return get(key)
                .filter(AttributeValue.Text.class::isInstance)
                .map(v -> ((AttributeValue.Text) v).value());
    }

    public Optional<Double> getNumber(String key) {
        return get(key)
                .filter(AttributeValue.Numeric.class::isInstance)
                .map(v -> ((AttributeValue.Numeric) v).value());
    }

    public Optional<Boolean> getFlag(String key) {
        return get(key)
                .filter(AttributeValue.Flag.class::isInstance)
                .map(v -> ((AttributeValue.Flag) v).value());
    }

    public List<String> getTextList(String key) {
        AttributeValue value = values.get(key);
        if (value instanceof AttributeValue.TextList list) {
            return list.values();
        }
        if (value instanceof AttributeValue.Text text) {
            return List.of(text.value());
        }
        return List.of();
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> raw = new LinkedHashMap<>();
        values.forEach((k, v) -> raw.put(k, v.raw()));
        return raw;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Attributes other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return toMap().toString();
    }

    public static final class Builder {

        private final Map<String, AttributeValue> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder text(String key, String value) {
            if (value != null) {
                values.put(key, new AttributeValue.Text(value));
            }
            return this;
        }

        public Builder number(String key, double value) {
            values.put(key, new AttributeValue.Numeric(value));
            return this;
        }

        public Builder flag(String key, boolean value) {
            values.put(key, new AttributeValue.Flag(value));
            return this;
        }

        public Builder textList(String key, List<String> value) {
            if (value != null) {
                values.put(key, new AttributeValue.TextList(value));
            }
            return this;
        }

        public Attributes build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new Attributes(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
