package com.github.jshook.cqllabs.config;

import java.time.Duration;

/**
 * Immutable record representing Cassandra connection configuration.
 */
public record ConnectionConfig(
    String host,
    int port,
    String username,
    String password,
    String keyspace,
    String localDatacenter,
    Duration connectTimeout,
    Duration requestTimeout
) {
    /**
     * Validates the connection configuration.
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public ConnectionConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Host cannot be null or blank");
        }

        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535");
        }

        if (localDatacenter == null || localDatacenter.isBlank()) {
            throw new IllegalArgumentException("Local datacenter cannot be null or blank");
        }

        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("Connect timeout must be positive");
        }

        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("Request timeout must be positive");
        }
    }

    /**
     * Checks if both username and password are set.
     * @return true if credentials should be sent, false otherwise
     */
    public boolean hasCredentials() {
        return username != null && !username.isBlank()
            && password != null && !password.isBlank();
    }
}
