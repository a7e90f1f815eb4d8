package com.github.jshook.cqllabs.exercise;

/**
 * Final state of one exercise run.
 */
public enum ExerciseOutcome {
    /** The body completed and every check held. */
    PASSED,
    /** A check did not hold or the body threw. */
    FAILED,
    /** The body reached a placeholder still to be completed. */
    PENDING,
    /** The exercise was not run. */
    IGNORED
}
