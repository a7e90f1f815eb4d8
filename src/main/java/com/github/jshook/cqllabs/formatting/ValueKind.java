package com.github.jshook.cqllabs.formatting;

/**
 * Alignment category of a column.
 */
public enum ValueKind {
    /**
     * Integers, floating point and decimal values. Rendered right aligned.
     */
    NUMERIC,

    /**
     * Any other value. Rendered left aligned.
     */
    OTHER
}
