package com.github.jshook.cqllabs.exercise;

import com.github.jshook.cqllabs.connection.ConnectionManager;
import com.github.jshook.cqllabs.connection.QueryExecutionException;
import com.github.jshook.cqllabs.output.ResultPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs registered exercises in order and reports the outcome of each one.
 */
public class ExerciseRunner {
    private static final Logger logger = LoggerFactory.getLogger(ExerciseRunner.class);

    private final ExerciseRegistry registry;
    private final ConnectionManager connectionManager;
    private final ResultPrinter resultPrinter;
    private final PrintStream outputStream;
    private final PrintStream errorStream;

    /**
     * Creates a new ExerciseRunner.
     *
     * @param registry          the exercises to run
     * @param connectionManager the connection manager handed to exercise bodies
     * @param resultPrinter     the printer for query results
     * @param outputStream      the output stream for banners, comments and checks
     * @param errorStream       the error stream for exercise errors
     */
    public ExerciseRunner(ExerciseRegistry registry, ConnectionManager connectionManager, ResultPrinter resultPrinter,
                          PrintStream outputStream, PrintStream errorStream) {
        this.registry = registry;
        this.connectionManager = connectionManager;
        this.resultPrinter = resultPrinter;
        this.outputStream = outputStream;
        this.errorStream = errorStream;
    }

    /**
     * Runs every exercise that is not ignored.
     *
     * @param title the section title
     * @return the report of the run
     */
    public ExerciseReport runSection(String title) {
        return runSection(title, List.of(), false);
    }

    /**
     * Runs a section of exercises.
     * <p>
     * When {@code selected} is empty every exercise is considered, and ignored ones run only if
     * {@code runIgnored} is set. Exercises named in {@code selected} always run.
     *
     * @param title      the section title
     * @param selected   names of the exercises to run, empty for all
     * @param runIgnored whether ignored exercises run as well
     * @return the report of the run
     * @throws IllegalArgumentException if a selected name is not registered
     */
    public ExerciseReport runSection(String title, Collection<String> selected, boolean runIgnored) {
        Set<String> selectedKeys = new LinkedHashSet<>();
        for (String name : selected) {
            if (!registry.isRegistered(name)) {
                throw new IllegalArgumentException("Unknown exercise: " + name);
            }
            selectedKeys.add(ExerciseRegistry.normalizeName(name));
        }

        outputStream.println("=== " + title + " ===");
        List<ExerciseResult> results = new ArrayList<>();
        for (Exercise exercise : registry.getExercises()) {
            String key = ExerciseRegistry.normalizeName(exercise.getName());
            if (!selectedKeys.isEmpty() && !selectedKeys.contains(key)) {
                continue;
            }
            boolean explicitlySelected = selectedKeys.contains(key);
            if (exercise.isIgnored() && !runIgnored && !explicitlySelected) {
                outputStream.println();
                outputStream.println("--- Exercise: " + exercise.getName() + " (ignored) ---");
                results.add(ExerciseResult.ignored(exercise.getName()));
                continue;
            }
            results.add(runExercise(exercise));
        }

        ExerciseReport report = new ExerciseReport(title, results);
        outputStream.println();
        outputStream.println("=== " + title + ": " + report.summary() + " ===");
        return report;
    }

    /**
     * Runs a single exercise, whatever its ignored flag.
     *
     * @param exercise the exercise to run
     * @return the result of the run
     */
    public ExerciseResult runExercise(Exercise exercise) {
        outputStream.println();
        outputStream.println("--- Exercise: " + exercise.getName() + " ---");

        ExerciseContext context = new ExerciseContext(connectionManager, resultPrinter, outputStream);
        ExerciseOutcome outcome;
        String message = null;
        try {
            exercise.run(context);
            outcome = context.getChecksFailed() > 0 ? ExerciseOutcome.FAILED : ExerciseOutcome.PASSED;
        } catch (ExerciseNotCompletedException e) {
            // any failed check makes the exercise FAILED
            outcome = context.getChecksFailed() > 0 ? ExerciseOutcome.FAILED : ExerciseOutcome.PENDING;
            message = e.getMessage();
        } catch (QueryExecutionException e) {
            outcome = ExerciseOutcome.FAILED;
            message = e.getMessage();
            errorStream.println("ERROR: " + e.getMessage());
            logger.error("Query execution error in exercise '{}': {}", exercise.getName(), e.getQuery(), e);
        } catch (Exception e) {
            outcome = ExerciseOutcome.FAILED;
            message = e.getMessage();
            errorStream.println("ERROR: " + e.getMessage());
            logger.error("Unexpected error in exercise '{}'", exercise.getName(), e);
        }

        outputStream.println("[" + outcome + "] " + exercise.getName()
            + (message != null && outcome == ExerciseOutcome.PENDING ? " - " + message : ""));
        return new ExerciseResult(exercise.getName(), outcome,
            context.getChecksPassed(), context.getChecksFailed(), message);
    }
}
