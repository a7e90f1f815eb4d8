package com.github.jshook.cqllabs.exercise;

/**
 * Immutable record of one exercise run.
 */
public record ExerciseResult(
    String name,
    ExerciseOutcome outcome,
    int checksPassed,
    int checksFailed,
    String message
) {
    public static ExerciseResult ignored(String name) {
        return new ExerciseResult(name, ExerciseOutcome.IGNORED, 0, 0, null);
    }
}
