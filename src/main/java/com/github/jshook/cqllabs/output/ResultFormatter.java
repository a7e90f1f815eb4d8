package com.github.jshook.cqllabs.output;

import com.github.jshook.cqllabs.formatting.TabularRow;

import java.util.List;

/**
 * Interface for formatting result rows.
 */
public interface ResultFormatter {
    /**
     * Formats rows into a string representation.
     *
     * @param rows the rows to format, all sharing the same columns
     * @return the formatted result
     */
    String format(List<? extends TabularRow> rows);
}
