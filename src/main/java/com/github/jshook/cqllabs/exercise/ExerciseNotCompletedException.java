package com.github.jshook.cqllabs.exercise;

/**
 * Thrown when an exercise reaches a placeholder the learner still has to fill in.
 */
public class ExerciseNotCompletedException extends RuntimeException {
    public ExerciseNotCompletedException() {
        super("Exercise not completed yet");
    }

    public ExerciseNotCompletedException(String message) {
        super(message);
    }
}
