package com.github.jshook.cqllabs.exercise;

import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.github.jshook.cqllabs.connection.ConnectionManager;
import com.github.jshook.cqllabs.formatting.TabularRow;
import com.github.jshook.cqllabs.output.ResultPrinter;

import java.io.PrintStream;
import java.util.List;

/**
 * Tools available to an exercise body while it runs. One context is created per exercise run.
 */
public class ExerciseContext {
    private final ConnectionManager connectionManager;
    private final ResultPrinter resultPrinter;
    private final PrintStream outputStream;
    private int checksPassed;
    private int checksFailed;

    /**
     * Creates a new ExerciseContext.
     *
     * @param connectionManager the connection manager, may be null when the exercises do not query
     * @param resultPrinter     the printer for query results
     * @param outputStream      the stream comments and checks are written to
     */
    public ExerciseContext(ConnectionManager connectionManager, ResultPrinter resultPrinter, PrintStream outputStream) {
        this.connectionManager = connectionManager;
        this.resultPrinter = resultPrinter;
        this.outputStream = outputStream;
    }

    /**
     * Gets the connection manager to run queries with.
     *
     * @return the connection manager
     * @throws IllegalStateException if the runner was created without one
     */
    public ConnectionManager connection() {
        if (connectionManager == null) {
            throw new IllegalStateException("No connection available to this exercise");
        }
        return connectionManager;
    }

    public void println(String text) {
        outputStream.println(text);
    }

    /**
     * Prints a comment line explaining the next step or check.
     *
     * @param text the comment
     */
    public void comment(String text) {
        outputStream.println("> " + text);
    }

    /**
     * Records and prints the result of a check. A failed check does not stop the exercise.
     *
     * @param condition the condition expected to hold
     * @return the condition
     */
    public boolean check(boolean condition) {
        if (condition) {
            checksPassed++;
            outputStream.println("  [OK]");
        } else {
            checksFailed++;
            outputStream.println("  [FAILED]");
        }
        return condition;
    }

    public void display(ResultSet resultSet) {
        resultPrinter.display(resultSet);
    }

    public void displayRows(List<Row> rows) {
        resultPrinter.displayRows(rows);
    }

    public void print(List<? extends TabularRow> rows) {
        resultPrinter.print(rows);
    }

    /**
     * Placeholder for a value the learner has to provide.
     *
     * @param <T> the expected type
     * @return never returns
     * @throws ExerciseNotCompletedException always
     */
    public <T> T todo() {
        throw new ExerciseNotCompletedException();
    }

    public int getChecksPassed() {
        return checksPassed;
    }

    public int getChecksFailed() {
        return checksFailed;
    }
}
