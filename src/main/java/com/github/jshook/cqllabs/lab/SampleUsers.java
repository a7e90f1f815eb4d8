package com.github.jshook.cqllabs.lab;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the users inserted by the lab from a CSV resource with an {@code id,name,age} header.
 */
public final class SampleUsers {
    /** Classpath location of the bundled sample users. */
    public static final String RESOURCE = "/lab/users.csv";

    private SampleUsers() {
    }

    /**
     * Loads the bundled sample users.
     *
     * @return the users, in file order
     */
    public static List<User> load() {
        InputStream in = SampleUsers.class.getResourceAsStream(RESOURCE);
        if (in == null) {
            throw new IllegalStateException("Sample users not found on classpath: " + RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + RESOURCE, e);
        }
    }

    /**
     * Parses users from CSV text.
     *
     * @param reader the CSV source
     * @return the users, in file order
     * @throws IOException if the source cannot be read
     * @throws IllegalArgumentException if a record is incomplete or an age is not a number
     */
    public static List<User> parse(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();
        List<User> users = new ArrayList<>();
        try (CSVParser parser = format.parse(reader)) {
            for (CSVRecord record : parser) {
                if (!record.isConsistent()) {
                    throw new IllegalArgumentException("Incomplete user record at line " + parser.getCurrentLineNumber());
                }
                String age = record.get("age");
                try {
                    users.add(new User(record.get("id"), record.get("name"), Integer.parseInt(age)));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid age '" + age + "' at line " + parser.getCurrentLineNumber(), e);
                }
            }
        }
        return users;
    }
}
