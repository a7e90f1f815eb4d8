package com.github.jshook.cqllabs.formatting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link TabularRow} backed by an insertion-ordered map.
 */
public class MapRow implements TabularRow {
    private final List<ColumnDescriptor> columns;
    private final Map<String, Object> values;

    private MapRow(List<ColumnDescriptor> columns, Map<String, Object> values) {
        this.columns = Collections.unmodifiableList(columns);
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<ColumnDescriptor> getColumns() {
        return columns;
    }

    @Override
    public boolean hasColumn(String name) {
        return values.containsKey(name);
    }

    @Override
    public Object getObject(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return values.get(name);
    }

    @Override
    public String toString() {
        return values.toString();
    }

    /**
     * Builds a {@link MapRow}, keeping the order in which columns are added.
     */
    public static class Builder {
        private final List<ColumnDescriptor> columns = new ArrayList<>();
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds a column and its value.
         *
         * @param column the column descriptor
         * @param value  the value, may be null
         * @return this builder
         */
        public Builder put(ColumnDescriptor column, Object value) {
            if (values.containsKey(column.name())) {
                throw new IllegalArgumentException("Duplicate column: " + column.name());
            }
            columns.add(column);
            values.put(column.name(), value);
            return this;
        }

        public Builder numeric(String name, Object value) {
            return put(ColumnDescriptor.numeric(name), value);
        }

        public Builder other(String name, Object value) {
            return put(ColumnDescriptor.other(name), value);
        }

        public MapRow build() {
            return new MapRow(new ArrayList<>(columns), new LinkedHashMap<>(values));
        }
    }
}
