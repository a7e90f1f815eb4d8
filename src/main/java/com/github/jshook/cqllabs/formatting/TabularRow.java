package com.github.jshook.cqllabs.formatting;

import java.util.List;

/**
 * One record of a result, exposing its values by column name.
 */
public interface TabularRow {
    /**
     * Gets the column descriptors of this row, in display order.
     * @return the column descriptors
     */
    List<ColumnDescriptor> getColumns();

    /**
     * Checks if this row carries a value for the given column.
     * @param name the column name
     * @return true if the column is part of this row, false otherwise
     */
    boolean hasColumn(String name);

    /**
     * Gets the value of a column.
     * @param name the column name
     * @return the value, or null if the cell is null
     * @throws IllegalArgumentException if the row has no such column
     */
    Object getObject(String name);
}
