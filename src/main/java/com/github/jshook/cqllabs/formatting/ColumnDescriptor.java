package com.github.jshook.cqllabs.formatting;

/**
 * Immutable record identifying one column of a tabular result.
 */
public record ColumnDescriptor(String name, ValueKind valueKind) {
    public ColumnDescriptor {
        if (name == null) {
            throw new IllegalArgumentException("Column name cannot be null");
        }
        if (valueKind == null) {
            throw new IllegalArgumentException("Value kind cannot be null");
        }
    }

    public static ColumnDescriptor numeric(String name) {
        return new ColumnDescriptor(name, ValueKind.NUMERIC);
    }

    public static ColumnDescriptor other(String name) {
        return new ColumnDescriptor(name, ValueKind.OTHER);
    }

    public boolean isNumeric() {
        return valueKind == ValueKind.NUMERIC;
    }
}
