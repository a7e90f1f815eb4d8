package com.github.jshook.cqllabs.driver;

import com.datastax.oss.driver.api.core.cql.ColumnDefinition;
import com.datastax.oss.driver.api.core.cql.ColumnDefinitions;
import com.datastax.oss.driver.api.core.cql.Row;
import com.github.jshook.cqllabs.formatting.ColumnDescriptor;
import com.github.jshook.cqllabs.formatting.TabularRow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapts a driver {@link Row} to {@link TabularRow}.
 * <p>
 * Column names are the internal (unquoted) CQL identifiers. Column kinds are resolved from the
 * column definitions, which the driver shares between all rows of a result set.
 */
public class DriverRow implements TabularRow {
    private final Row row;
    private final List<ColumnDescriptor> columns;
    private final Map<String, Integer> indexes;

    private DriverRow(Row row, List<ColumnDescriptor> columns, Map<String, Integer> indexes) {
        this.row = row;
        this.columns = columns;
        this.indexes = indexes;
    }

    /**
     * Wraps driver rows, resolving column descriptors once for each distinct set of column definitions.
     *
     * @param rows the driver rows
     * @return the adapted rows, in the same order
     */
    public static List<DriverRow> wrap(List<Row> rows) {
        List<DriverRow> wrapped = new ArrayList<>(rows.size());
        ColumnDefinitions lastDefinitions = null;
        List<ColumnDescriptor> columns = null;
        Map<String, Integer> indexes = null;
        for (Row row : rows) {
            ColumnDefinitions definitions = row.getColumnDefinitions();
            if (definitions != lastDefinitions) {
                columns = new ArrayList<>(definitions.size());
                indexes = new HashMap<>();
                for (int i = 0; i < definitions.size(); i++) {
                    ColumnDefinition definition = definitions.get(i);
                    String name = definition.getName().asInternal();
                    columns.add(new ColumnDescriptor(name, ValueKinds.of(definition.getType())));
                    indexes.putIfAbsent(name, i);
                }
                columns = Collections.unmodifiableList(columns);
                lastDefinitions = definitions;
            }
            wrapped.add(new DriverRow(row, columns, indexes));
        }
        return wrapped;
    }

    @Override
    public List<ColumnDescriptor> getColumns() {
        return columns;
    }

    @Override
    public boolean hasColumn(String name) {
        return indexes.containsKey(name);
    }

    @Override
    public Object getObject(String name) {
        Integer index = indexes.get(name);
        if (index == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return row.isNull(index) ? null : row.getObject(index);
    }
}
