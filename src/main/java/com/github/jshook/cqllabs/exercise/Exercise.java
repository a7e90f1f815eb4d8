package com.github.jshook.cqllabs.exercise;

/**
 * Interface for a guided exercise run against the cluster.
 */
public interface Exercise {
    /**
     * Runs the exercise body.
     * @param context what the body can use to query, print and check results
     * @throws Exception if the body fails; the runner reports it and moves to the next exercise
     */
    void run(ExerciseContext context) throws Exception;

    /**
     * Gets the name of the exercise.
     * @return the name of the exercise
     */
    String getName();

    /**
     * Checks if the exercise is skipped unless explicitly requested.
     * @return true if the exercise is ignored by default
     */
    default boolean isIgnored() {
        return false;
    }
}
