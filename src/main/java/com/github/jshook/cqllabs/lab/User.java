package com.github.jshook.cqllabs.lab;

import com.datastax.oss.driver.api.core.cql.Row;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Immutable record of a row of the lab user table.
 */
@JsonPropertyOrder({"id", "name", "age"})
public record User(String id, String name, int age) {

    /**
     * Converts a row selected with the {@code id}, {@code name} and {@code age} columns.
     *
     * @param row the driver row
     * @return the user
     */
    public static User fromRow(Row row) {
        return new User(row.getString("id"), row.getString("name"), row.getInt("age"));
    }
}
