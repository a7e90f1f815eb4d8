package com.github.jshook.cqllabs.connection;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import com.datastax.oss.driver.api.core.config.DefaultDriverOption;
import com.datastax.oss.driver.api.core.config.DriverConfigLoader;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.github.jshook.cqllabs.config.ConnectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Manages the session to a Cassandra cluster and provides methods for executing queries.
 */
public class ConnectionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    private final ConnectionConfig config;
    private final AtomicReference<CqlSession> sessionRef = new AtomicReference<>();
    private final Map<String, PreparedStatement> preparedStatements = new ConcurrentHashMap<>();

    /**
     * Creates a new ConnectionManager with the given configuration.
     * @param config the connection configuration
     */
    public ConnectionManager(ConnectionConfig config) {
        this.config = config;
    }

    /**
     * Connects to the Cassandra cluster using the connection configuration.
     * @throws ConnectionException if the connection fails
     */
    public void connect() throws ConnectionException {
        try {
            DriverConfigLoader configLoader = DriverConfigLoader.programmaticBuilder()
                .withDuration(DefaultDriverOption.CONNECTION_CONNECT_TIMEOUT, config.connectTimeout())
                .withDuration(DefaultDriverOption.REQUEST_TIMEOUT, config.requestTimeout())
                .build();

            CqlSessionBuilder builder = CqlSession.builder()
                .addContactPoint(new InetSocketAddress(config.host(), config.port()))
                .withLocalDatacenter(config.localDatacenter())
                .withConfigLoader(configLoader);

            if (config.hasCredentials()) {
                builder.withAuthCredentials(config.username(), config.password());
            }

            if (config.keyspace() != null && !config.keyspace().isBlank()) {
                builder.withKeyspace(config.keyspace());
            }

            CqlSession session = builder.build();
            CqlSession previous = sessionRef.getAndSet(session);
            if (previous != null) {
                previous.close();
            }
            preparedStatements.clear();

            logger.info("Connected to cluster {} at {}:{}",
                session.getMetadata().getClusterName().orElse("<unknown>"), config.host(), config.port());
        } catch (Exception e) {
            throw new ConnectionException("Failed to connect to Cassandra: " + e.getMessage(), e);
        }
    }

    /**
     * Executes a CQL statement and returns the result set.
     * @param cql the CQL statement to execute
     * @return the result set
     * @throws QueryExecutionException if the query execution fails
     */
    public ResultSet execute(String cql) throws QueryExecutionException {
        CqlSession session = requireSession();
        logger.debug("Executing: {}", cql);
        try {
            return session.execute(SimpleStatement.newInstance(cql));
        } catch (Exception e) {
            throw new QueryExecutionException("Failed to execute query: " + e.getMessage(), cql, e);
        }
    }

    /**
     * Prepares a CQL statement with {@code ?} placeholders, binds the values positionally and executes it.
     * The prepared statement is cached by query text and reused on later calls.
     * @param cql the CQL statement with placeholders
     * @param values the values to bind, in placeholder order
     * @return the result set
     * @throws QueryExecutionException if preparing, binding or executing fails
     */
    public ResultSet execute(String cql, Object... values) throws QueryExecutionException {
        CqlSession session = requireSession();
        try {
            PreparedStatement prepared = preparedStatements.computeIfAbsent(cql, session::prepare);
            BoundStatement bound = prepared.bind(values);
            logger.debug("Executing prepared: {} with {} bound values", cql, values.length);
            return session.execute(bound);
        } catch (Exception e) {
            throw new QueryExecutionException("Failed to execute query: " + e.getMessage(), cql, e);
        }
    }

    /**
     * Gets the cluster name.
     * @return the cluster name
     */
    public String getClusterName() {
        return requireSession().getMetadata().getClusterName().orElse("Unknown Cluster");
    }

    /**
     * Gets the host from the connection configuration.
     * @return the host
     */
    public String getHost() {
        return config.host();
    }

    /**
     * Gets the port from the connection configuration.
     * @return the port
     */
    public int getPort() {
        return config.port();
    }

    /**
     * Closes the connection to the Cassandra cluster.
     */
    @Override
    public void close() {
        CqlSession session = sessionRef.getAndSet(null);
        preparedStatements.clear();
        if (session != null) {
            session.close();
            logger.info("Disconnected from Cassandra cluster");
        }
    }

    private CqlSession requireSession() {
        CqlSession session = sessionRef.get();
        if (session == null) {
            throw new IllegalStateException("Not connected to Cassandra");
        }
        return session;
    }
}
