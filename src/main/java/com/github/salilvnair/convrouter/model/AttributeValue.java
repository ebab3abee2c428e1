package com.github.salilvnair.convrouter.model;

import java.util.List;
import java.util.Objects;

/**
 * Closed set of value kinds that may be stored in {@link Attributes}.
 */
public sealed interface AttributeValue
        permits AttributeValue.Text, AttributeValue.Numeric, AttributeValue.Flag, AttributeValue.TextList {

    /**
     * Plain Java value used for serialization and display.
     */
    Object raw();

    record Text(String value) implements AttributeValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record Numeric(double value) implements AttributeValue {
        @Override
        public Object raw() {
            if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < Long.MAX_VALUE) {
                return (long) value;
            }
            return value;
        }
    }

    record Flag(boolean value) implements AttributeValue {
        @Override
        public Object raw() {
            return value;
        }
    }

    record TextList(List<String> values) implements AttributeValue {
        public TextList {
            values = List.copyOf(values);
        }

        @Override
        public Object raw() {
            return values;
        }
    }

    static AttributeValue of(Object value) {
        if (value instanceof AttributeValue attributeValue) {
            return attributeValue;
        }
        if (value instanceof String s) {
            return new Text(s);
        }
        if (value instanceof Number n) {
            return new Numeric(n.doubleValue());
        }
        if (value instanceof Boolean b) {
            return new Flag(b);
        }
        if (value instanceof List<?> list) {
            return new TextList(list.stream().map(String::valueOf).toList());
        }
        throw new IllegalArgumentException("Unsupported attribute value type: "
                + (value == null ? "null" : value.getClass().getName()));
    }
}
