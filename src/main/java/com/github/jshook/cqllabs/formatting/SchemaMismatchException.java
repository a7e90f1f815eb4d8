package com.github.jshook.cqllabs.formatting;

/**
 * Exception thrown when a row does not provide a column declared for the table being rendered.
 */
public class SchemaMismatchException extends IllegalArgumentException {
    private final int rowIndex;
    private final String columnName;

    /**
     * Creates a new SchemaMismatchException for the given row and column.
     * @param rowIndex the zero-based index of the offending row
     * @param columnName the column missing from that row
     */
    public SchemaMismatchException(int rowIndex, String columnName) {
        super("Row " + rowIndex + " has no value for column '" + columnName + "'");
        this.rowIndex = rowIndex;
        this.columnName = columnName;
    }

    public int getRowIndex() {
        return rowIndex;
    }

    public String getColumnName() {
        return columnName;
    }
}
