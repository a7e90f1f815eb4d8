package com.github.jshook.cqllabs.lab;

import com.github.jshook.cqllabs.exercise.ExerciseRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BasicOperationsLabTest {

    @Test
    public void testExerciseOrder() {
        ExerciseRegistry registry = new BasicOperationsLab(LabSettings.defaults()).createRegistry();

        assertEquals(List.of(
            "Check the cluster",
            "Create a keyspace",
            "Create a table",
            "Add data",
            "Query data",
            "Query data as JSON document",
            "Query with constraint",
            "Use prepared statement",
            "Find many users",
            "Query with constraint on non-key field"), registry.getExerciseNames());
    }

    @Test
    public void testOnlyKeyspaceCreationIsIgnored() {
        ExerciseRegistry registry = new BasicOperationsLab(LabSettings.defaults()).createRegistry();

        assertTrue(registry.getExercise("Create a keyspace").isIgnored());
        registry.getExercises().stream()
            .filter(exercise -> !exercise.getName().equals("Create a keyspace"))
            .forEach(exercise -> assertFalse(exercise.isIgnored(), exercise.getName()));
    }
}
