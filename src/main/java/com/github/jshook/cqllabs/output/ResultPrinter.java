package com.github.jshook.cqllabs.output;

import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.github.jshook.cqllabs.config.FormattingConfig;
import com.github.jshook.cqllabs.driver.DriverRow;
import com.github.jshook.cqllabs.formatting.TabularRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

/**
 * Writes formatted results to an output stream.
 */
public class ResultPrinter {
    private static final Logger logger = LoggerFactory.getLogger(ResultPrinter.class);

    private final ResultFormatterFactory formatterFactory;
    private final PrintStream outputStream;

    /**
     * Creates a new ResultPrinter writing to standard output.
     *
     * @param formattingConfig the formatting configuration to use for displaying results
     */
    public ResultPrinter(FormattingConfig formattingConfig) {
        this(formattingConfig, System.out);
    }

    /**
     * Creates a new ResultPrinter.
     *
     * @param formattingConfig the formatting configuration to use for displaying results
     * @param outputStream     the output stream to use for displaying results
     */
    public ResultPrinter(FormattingConfig formattingConfig, PrintStream outputStream) {
        this.formatterFactory = new ResultFormatterFactory(formattingConfig);
        this.outputStream = outputStream;
    }

    /**
     * Fetches all remaining rows of a result set and prints them.
     *
     * @param resultSet the result set, consumed by this call
     */
    public void display(ResultSet resultSet) {
        displayRows(resultSet.all());
    }

    /**
     * Prints driver rows.
     *
     * @param rows the rows to print
     */
    public void displayRows(List<Row> rows) {
        print(DriverRow.wrap(rows));
    }

    /**
     * Prints rows of any origin.
     *
     * @param rows the rows to print, null is printed as no rows
     */
    public void print(List<? extends TabularRow> rows) {
        String formatted = formatterFactory.createFormatter().format(rows);
        logger.debug("Printing {} rows", rows == null ? 0 : rows.size());
        outputStream.println(formatted);
    }
}
