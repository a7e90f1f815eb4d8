package com.github.jshook.cqllabs.lab;

import com.datastax.oss.driver.api.core.cql.ResultSet;
import com.datastax.oss.driver.api.core.cql.Row;
import com.github.jshook.cqllabs.connection.ConnectionManager;
import com.github.jshook.cqllabs.exercise.ExerciseContext;
import com.github.jshook.cqllabs.exercise.ExerciseRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Guided exercises on basic Cassandra operations: inspecting the cluster, creating a keyspace and a
 * table, inserting rows, and querying them with plain and prepared statements.
 * <p>
 * Cassandra tables are designed query first: rows can only be looked up efficiently through their
 * partition key, and there are no joins. The last exercise shows what happens when filtering on a
 * regular column.
 */
public class BasicOperationsLab {
    private static final Logger logger = LoggerFactory.getLogger(BasicOperationsLab.class);

    public static final String TITLE = "Discovering Cassandra";

    private final LabSettings settings;

    public BasicOperationsLab(LabSettings settings) {
        this.settings = settings;
    }

    /**
     * Creates a registry holding the exercises of this lab, in the order a learner should run them.
     *
     * @return the registry
     */
    public ExerciseRegistry createRegistry() {
        ExerciseRegistry registry = new ExerciseRegistry();
        registry.register("Check the cluster", this::checkTheCluster);
        registry.registerIgnored("Create a keyspace", this::createKeyspace);
        registry.register("Create a table", this::createTable);
        registry.register("Add data", this::addData);
        registry.register("Query data", this::queryData);
        registry.register("Query data as JSON document", this::queryDataAsJson);
        registry.register("Query with constraint", this::queryWithConstraint);
        registry.register("Use prepared statement", this::usePreparedStatement);
        registry.register("Find many users", this::findManyUsers);
        registry.register("Query with constraint on non-key field", this::queryOnNonKeyField);
        return registry;
    }

    /**
     * Information about the node we are connected to lives in {@code system.local}, the other nodes
     * are listed in {@code system.peers}.
     */
    void checkTheCluster(ExerciseContext context) throws Exception {
        ConnectionManager connection = context.connection();

        List<Row> localRows = connection.execute("SELECT * FROM system.local").all();
        context.displayRows(localRows);

        boolean ready = localRows.size() == 1 && "COMPLETED".equals(localRows.get(0).getString("bootstrapped"));
        context.comment(ready ? "Cassandra is ready" : "Cassandra is not ready");

        context.comment("Do we have 1 local node?");
        context.check(localRows.size() == 1);
        context.comment("Is the local node ready?");
        context.check(ready);

        List<Row> peersRows = connection.execute("SELECT * FROM system.peers").all();
        context.displayRows(peersRows);

        context.comment("How many nodes do we have in the Cassandra cluster?");
        Integer expectedNodes = settings.expectedNodes() != null
            ? settings.expectedNodes()
            : context.<Integer>todo();
        context.check(peersRows.size() + 1 == expectedNodes);
    }

    /**
     * The replication factor should match the number of available nodes. Ignored by default: run it
     * once, then leave the keyspace in place.
     */
    void createKeyspace(ExerciseContext context) throws Exception {
        context.connection().execute("CREATE KEYSPACE IF NOT EXISTS " + settings.keyspace() + " WITH replication = {\n"
            + "  'class':              'SimpleStrategy',\n"
            + "  'replication_factor': '" + settings.replicationFactor() + "'\n"
            + "}");
        context.comment("Keyspace " + settings.keyspace() + " is available");
    }

    void createTable(ExerciseContext context) throws Exception {
        ConnectionManager connection = context.connection();
        connection.execute("DROP TABLE IF EXISTS " + settings.userTable());
        connection.execute("CREATE TABLE IF NOT EXISTS " + settings.userTable() + " (\n"
            + "  id   text,\n"
            + "  name text,\n"
            + "  age  int,\n"
            + "  PRIMARY KEY (id, name)\n"
            + ")");
        context.comment("Table " + settings.userTable() + " created");
    }

    /**
     * Besides the usual SQL-like syntax, CQL accepts a JSON document as the row to insert.
     */
    void addData(ExerciseContext context) throws Exception {
        ConnectionManager connection = context.connection();
        connection.execute("INSERT INTO " + settings.userTable()
            + " JSON '{  \"id\": \"123\",  \"name\": \"jon\",  \"age\": 32 }'");
        connection.execute("INSERT INTO " + settings.userTable()
            + " JSON '{  \"id\": \"456\",  \"name\": \"mary\",  \"age\": 25 }'");

        UserRepository repository = new UserRepository(connection, settings.userTable());
        List<User> users = SampleUsers.load();
        for (User user : users) {
            repository.insertJson(user);
        }
        logger.debug("Inserted {} sample users into {}", users.size() + 2, settings.userTable());
        context.comment((users.size() + 2) + " users inserted");
    }

    /**
     * LIMIT keeps the output readable while exploring data.
     */
    void queryData(ExerciseContext context) throws Exception {
        ResultSet result = context.connection().execute("SELECT id, name, age FROM " + settings.userTable() + " LIMIT 100");
        context.println("List of all users");
        context.display(result);
    }

    void queryDataAsJson(ExerciseContext context) throws Exception {
        ResultSet result = context.connection()
            .execute("SELECT JSON id, name, age FROM " + settings.userTable() + " LIMIT 100");
        context.println("List of all users (JSON)");
        context.display(result);
    }

    void queryWithConstraint(ExerciseContext context) throws Exception {
        List<Row> rows = context.connection()
            .execute("SELECT id, name, age FROM " + settings.userTable() + " WHERE id = '123' LIMIT 100")
            .all();

        context.comment("Data collected");
        context.displayRows(rows);

        context.comment("Did we get 1 user?");
        context.check(rows.size() == 1);
        context.comment("Does the collected user have ID '123'?");
        context.check(!rows.isEmpty() && "123".equals(rows.get(0).getString("id")));
    }

    /**
     * A prepared statement has {@code ?} markers bound to values at execution time, so that a
     * parameter can never change the shape of the query.
     */
    void usePreparedStatement(ExerciseContext context) throws Exception {
        UserRepository repository = new UserRepository(context.connection(), settings.userTable());
        Optional<User> user = repository.findUserById("123");

        context.comment("Did we get 1 user?");
        context.check(user.isPresent());
        context.comment("Check collected data");
        context.check(user.map(new User("123", "jon", 32)::equals).orElse(false));
    }

    void findManyUsers(ExerciseContext context) throws Exception {
        UserRepository repository = new UserRepository(context.connection(), settings.userTable());
        List<User> result = repository.findUsersByIds(List.of("123", "456")).stream()
            .sorted(Comparator.comparing(User::id))
            .collect(Collectors.toList());

        context.comment("Check collected data");
        context.check(result.equals(List.of(
            new User("123", "jon", 32),
            new User("456", "mary", 25))));
    }

    /**
     * Without ALLOW FILTERING the cluster rejects a constraint on a regular column, because it
     * would have to scan every partition. Prefer fetching by key and filtering in the application.
     */
    void queryOnNonKeyField(ExerciseContext context) throws Exception {
        ResultSet result = context.connection()
            .execute("SELECT id, name, age FROM " + settings.userTable() + " WHERE age >= 30 ALLOW FILTERING");
        context.comment("Users greater or equal to 30");
        context.display(result);
    }
}
