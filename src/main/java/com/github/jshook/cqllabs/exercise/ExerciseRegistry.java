package com.github.jshook.cqllabs.exercise;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Registry for exercises, keeping them in registration order.
 */
public class ExerciseRegistry {
    private final Map<String, Exercise> exercises = new LinkedHashMap<>();

    /**
     * Registers an exercise implementation.
     *
     * @param exercise the exercise to register
     * @throws IllegalArgumentException if an exercise with the same name is already registered
     */
    public void registerExercise(Exercise exercise) {
        String key = normalizeName(exercise.getName());
        if (exercises.containsKey(key)) {
            throw new IllegalArgumentException("Exercise already registered: " + exercise.getName());
        }
        exercises.put(key, exercise);
    }

    /**
     * Registers a body as an exercise.
     *
     * @param name the exercise name
     * @param body the body to run for this exercise
     */
    public void register(String name, ExerciseBody body) {
        registerExercise(named(name, false, body));
    }

    /**
     * Registers a body as an exercise that only runs when explicitly requested.
     *
     * @param name the exercise name
     * @param body the body to run for this exercise
     */
    public void registerIgnored(String name, ExerciseBody body) {
        registerExercise(named(name, true, body));
    }

    /**
     * Checks if an exercise name is registered, ignoring case.
     *
     * @param name the exercise name
     * @return true if registered, false otherwise
     */
    public boolean isRegistered(String name) {
        return exercises.containsKey(normalizeName(name));
    }

    /**
     * Gets the exercise for the given name, ignoring case.
     *
     * @param name the exercise name
     * @return the exercise, or null if not found
     */
    public Exercise getExercise(String name) {
        return exercises.get(normalizeName(name));
    }

    /**
     * Gets all exercises in registration order.
     *
     * @return the exercises
     */
    public List<Exercise> getExercises() {
        return Collections.unmodifiableList(new ArrayList<>(exercises.values()));
    }

    /**
     * Gets the exercise names in registration order.
     *
     * @return the exercise names
     */
    public List<String> getExerciseNames() {
        List<String> names = new ArrayList<>(exercises.size());
        for (Exercise exercise : exercises.values()) {
            names.add(exercise.getName());
        }
        return names;
    }

    /**
     * Normalizes an exercise name for lookups: surrounding blanks removed, case folded.
     *
     * @param name the exercise name
     * @return the lookup key
     */
    public static String normalizeName(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static Exercise named(String name, boolean ignored, ExerciseBody body) {
        return new Exercise() {
            @Override
            public void run(ExerciseContext context) throws Exception {
                body.run(context);
            }

            @Override
            public String getName() {
                return name;
            }

            @Override
            public boolean isIgnored() {
                return ignored;
            }
        };
    }
}
