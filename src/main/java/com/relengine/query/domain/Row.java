package com.relengine.query.domain;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single record: an immutable mapping from field name to text value.
 * A field that is absent is distinct from a field holding the empty string.
 */
public final class Row {

    private static final Row EMPTY = new Row(ImmutableMap.of());

    private final ImmutableMap<String, String> fields;

    private Row(ImmutableMap<String, String> fields) {
        this.fields = fields;
    }

    public static Row empty() {
        return EMPTY;
    }

    public static Row of(Map<String, String> fields) {
        return new Row(ImmutableMap.copyOf(fields));
    }

    public static Row of(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs, got " + namesAndValues.length + " arguments");
        }
        ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            builder.put(namesAndValues[i], namesAndValues[i + 1]);
        }
        return new Row(builder.buildOrThrow());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, String> getFields() {
        return fields;
    }

    public boolean hasField(String fieldName) {
        return fields.containsKey(fieldName);
    }

    /**
     * Returns the value of a field, or {@code null} when the row does not hold it.
     */
    public String getFieldValue(String fieldName) {
        return fields.get(fieldName);
    }

    public int size() {
        return fields.size();
    }

    /**
     * Returns a new row holding the fields of both rows.
     * Fields of {@code other} replace fields of this row with the same name.
     */
    public Row mergeFields(Row other) {
        if (other == null || other.fields.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(fields.size() + other.fields.size());
        merged.putAll(fields);
        merged.putAll(other.fields);
        return new Row(ImmutableMap.copyOf(merged));
    }

    public Row withField(String fieldName, String value) {
        Map<String, String> copy = new LinkedHashMap<>(fields);
        copy.put(fieldName, value);
        return new Row(ImmutableMap.copyOf(copy));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Row that = (Row) obj;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return fields.toString();
    }

    public static final class Builder {

        private final Map<String, String> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder set(String fieldName, String value) {
            fields.put(fieldName, value);
            return this;
        }

        public Row build() {
            return new Row(ImmutableMap.copyOf(fields));
        }
    }
}
