package com.github.jshook.cqllabs.exercise;

import java.util.Collections;
import java.util.List;

/**
 * Results of a section run, in execution order.
 */
public class ExerciseReport {
    private final String title;
    private final List<ExerciseResult> results;

    public ExerciseReport(String title, List<ExerciseResult> results) {
        this.title = title;
        this.results = Collections.unmodifiableList(results);
    }

    public String getTitle() {
        return title;
    }

    public List<ExerciseResult> getResults() {
        return results;
    }

    /**
     * Counts the exercises that ended with the given outcome.
     *
     * @param outcome the outcome to count
     * @return the number of exercises with that outcome
     */
    public long count(ExerciseOutcome outcome) {
        return results.stream().filter(result -> result.outcome() == outcome).count();
    }

    public boolean hasFailures() {
        return count(ExerciseOutcome.FAILED) > 0;
    }

    /**
     * Gets a one-line summary such as {@code 7 passed, 1 failed, 1 pending, 1 ignored}.
     *
     * @return the summary line
     */
    public String summary() {
        return String.format("%d passed, %d failed, %d pending, %d ignored",
            count(ExerciseOutcome.PASSED),
            count(ExerciseOutcome.FAILED),
            count(ExerciseOutcome.PENDING),
            count(ExerciseOutcome.IGNORED));
    }
}
