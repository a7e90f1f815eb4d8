package com.github.jshook.cqllabs.exercise;

/**
 * Body of an exercise registered by name.
 */
@FunctionalInterface
public interface ExerciseBody {
    void run(ExerciseContext context) throws Exception;
}
