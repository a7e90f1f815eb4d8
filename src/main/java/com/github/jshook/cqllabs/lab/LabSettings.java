package com.github.jshook.cqllabs.lab;

import java.util.regex.Pattern;

/**
 * Immutable record of the lab parameters a learner may change.
 *
 * @param keyspace          keyspace the exercises create and use
 * @param replicationFactor replication factor of that keyspace
 * @param expectedNodes     number of nodes the learner expects in the cluster, null if not answered yet
 */
public record LabSettings(String keyspace, int replicationFactor, Integer expectedNodes) {
    public static final String DEFAULT_KEYSPACE = "education";
    public static final int DEFAULT_REPLICATION_FACTOR = 3;

    private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z][a-zA-Z0-9_]{0,47}");

    public LabSettings {
        // keyspace is concatenated into CQL text
        if (keyspace == null || !IDENTIFIER.matcher(keyspace).matches()) {
            throw new IllegalArgumentException("Invalid keyspace name: " + keyspace);
        }
        if (replicationFactor < 1) {
            throw new IllegalArgumentException("Replication factor must be at least 1");
        }
        if (expectedNodes != null && expectedNodes < 1) {
            throw new IllegalArgumentException("Expected node count must be at least 1");
        }
    }

    public static LabSettings defaults() {
        return new LabSettings(DEFAULT_KEYSPACE, DEFAULT_REPLICATION_FACTOR, null);
    }

    /**
     * Gets the qualified name of the user table.
     * @return {@code <keyspace>.user}
     */
    public String userTable() {
        return keyspace + ".user";
    }
}
