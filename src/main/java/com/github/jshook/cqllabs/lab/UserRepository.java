package com.github.jshook.cqllabs.lab;

import com.datastax.oss.driver.api.core.cql.Row;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.jshook.cqllabs.connection.ConnectionManager;
import com.github.jshook.cqllabs.connection.QueryExecutionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes lab users through prepared statements.
 */
public class UserRepository {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ConnectionManager connectionManager;
    private final String table;

    /**
     * Creates a new UserRepository.
     *
     * @param connectionManager the connection manager to run queries with
     * @param table             the qualified user table name
     */
    public UserRepository(ConnectionManager connectionManager, String table) {
        this.connectionManager = connectionManager;
        this.table = table;
    }

    /**
     * Inserts a user with the JSON form of {@code INSERT}.
     *
     * @param user the user to insert
     * @throws QueryExecutionException if the insert fails
     */
    public void insertJson(User user) throws QueryExecutionException {
        connectionManager.execute(insertJsonStatement(table, user));
    }

    /**
     * Finds the user with the given id.
     *
     * @param id the user id
     * @return the user, or empty if there is none
     * @throws QueryExecutionException if the query fails
     * @throws IllegalStateException if more than one row has this id
     */
    public Optional<User> findUserById(String id) throws QueryExecutionException {
        List<Row> rows = connectionManager
            .execute("SELECT id, name, age FROM " + table + " WHERE id = ?", id)
            .all();
        if (rows.size() > 1) {
            throw new IllegalStateException("Expected at most one user with id " + id + ", found " + rows.size());
        }
        return rows.stream().findFirst().map(User::fromRow);
    }

    /**
     * Finds the users whose id is in the given list, binding the whole list to a single {@code IN ?} marker.
     *
     * @param ids the user ids
     * @return the users found, in the order returned by the cluster
     * @throws QueryExecutionException if the query fails
     */
    public List<User> findUsersByIds(List<String> ids) throws QueryExecutionException {
        List<User> users = new ArrayList<>();
        for (Row row : connectionManager.execute("SELECT id, name, age FROM " + table + " WHERE id IN ?", ids)) {
            users.add(User.fromRow(row));
        }
        return users;
    }

    /**
     * Builds an {@code INSERT ... JSON} statement for a user.
     *
     * @param table the qualified table name
     * @param user  the user
     * @return the CQL statement
     */
    public static String insertJsonStatement(String table, User user) {
        try {
            String json = MAPPER.writeValueAsString(user);
            return "INSERT INTO " + table + " JSON '" + json.replace("'", "''") + "'";
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize user " + user.id(), e);
        }
    }
}
