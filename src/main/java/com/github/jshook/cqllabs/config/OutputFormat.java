package com.github.jshook.cqllabs.config;

/**
 * Enum representing the available output formats for query results.
 */
public enum OutputFormat {
    /**
     * Bordered ASCII table.
     */
    TABULAR,

    /**
     * JSON array with one object per row.
     */
    JSON,

    /**
     * CSV with a header record.
     */
    CSV
}
