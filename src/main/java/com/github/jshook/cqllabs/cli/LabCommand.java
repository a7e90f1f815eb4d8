package com.github.jshook.cqllabs.cli;

import com.github.jshook.cqllabs.config.ConnectionConfig;
import com.github.jshook.cqllabs.config.FormattingConfig;
import com.github.jshook.cqllabs.config.OutputFormat;
import com.github.jshook.cqllabs.connection.ConnectionManager;
import com.github.jshook.cqllabs.exercise.ExerciseRegistry;
import com.github.jshook.cqllabs.exercise.ExerciseReport;
import com.github.jshook.cqllabs.exercise.ExerciseRunner;
import com.github.jshook.cqllabs.lab.BasicOperationsLab;
import com.github.jshook.cqllabs.lab.LabSettings;
import com.github.jshook.cqllabs.output.ResultPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Main command, handling CLI arguments, connecting to the cluster and running the lab exercises.
 */
@Command(
    name = "cqllabs",
    description = "Guided exercises on basic Cassandra operations",
    mixinStandardHelpOptions = true,
    version = "1.0"
)
public class LabCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(LabCommand.class);

    private final PrintStream out;
    private final PrintStream err;

    // Connection parameters
    @Option(names = {"-H", "--host"}, description = "Cassandra host address (default: ${DEFAULT-VALUE})")
    private String host = "localhost";

    @Option(names = {"-p", "--port"}, description = "Cassandra port number (default: ${DEFAULT-VALUE})")
    private int port = 9042;

    @Option(names = {"-u", "--username"}, description = "Username for authentication")
    private String username;

    @Option(names = {"--password"}, description = "Password for authentication", interactive = true, arity = "0..1")
    private String password;

    @Option(names = {"-k", "--keyspace"}, description = "Keyspace the session starts in")
    private String keyspace;

    @Option(names = {"--dc"}, description = "Local data center name (default: ${DEFAULT-VALUE})")
    private String localDatacenter = "datacenter1";

    // Timeout settings
    @Option(names = {"--connect-timeout"}, description = "Connection timeout in seconds (default: ${DEFAULT-VALUE})")
    private int connectTimeout = 5;

    @Option(names = {"--request-timeout"}, description = "Request timeout in seconds (default: ${DEFAULT-VALUE})")
    private int requestTimeout = 10;

    // Output formatting
    @Option(names = {"--output-format"}, description = "Output format (${COMPLETION-CANDIDATES})")
    private OutputFormat outputFormat = OutputFormat.TABULAR;

    // Lab settings
    @Option(names = {"--lab-keyspace"}, description = "Keyspace used by the exercises (default: ${DEFAULT-VALUE})")
    private String labKeyspace = LabSettings.DEFAULT_KEYSPACE;

    @Option(names = {"--replication-factor"}, description = "Replication factor of the lab keyspace (default: ${DEFAULT-VALUE})")
    private int replicationFactor = LabSettings.DEFAULT_REPLICATION_FACTOR;

    @Option(names = {"--expected-nodes"}, description = "Your answer: how many nodes the cluster has")
    private Integer expectedNodes;

    @Option(names = {"--run-ignored"}, description = "Also run exercises that are ignored by default")
    private boolean runIgnored = false;

    @Option(names = {"-e", "--exercise"}, description = "Run only the named exercise (repeatable)")
    private List<String> exercises = new ArrayList<>();

    @Option(names = {"--list"}, description = "List the exercises and exit")
    private boolean list = false;

    @Option(names = {"--debug"}, description = "Enable debug mode")
    private boolean debug = false;

    public LabCommand() {
        this(System.out, System.err);
    }

    /**
     * Creates a new LabCommand writing to the given streams.
     *
     * @param out the stream for exercise output
     * @param err the stream for errors
     */
    public LabCommand(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        // Logging is configured via logback.xml with default level WARN
        if (debug) {
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                org.slf4j.LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        LabSettings labSettings;
        ExerciseRegistry registry;
        try {
            labSettings = toLabSettings();
            registry = new BasicOperationsLab(labSettings).createRegistry();
            for (String name : exercises) {
                if (!registry.isRegistered(name)) {
                    throw new IllegalArgumentException("Unknown exercise: " + name);
                }
            }
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        }

        if (list) {
            for (String name : registry.getExerciseNames()) {
                boolean ignored = registry.getExercise(name).isIgnored();
                out.println(name + (ignored ? " (ignored by default)" : ""));
            }
            return 0;
        }

        try (ConnectionManager connectionManager = new ConnectionManager(toConnectionConfig())) {
            connectionManager.connect();
            out.println("Connected to " + connectionManager.getClusterName()
                + " at " + connectionManager.getHost() + ":" + connectionManager.getPort());

            ResultPrinter printer = new ResultPrinter(new FormattingConfig(outputFormat), out);
            ExerciseRunner runner = new ExerciseRunner(registry, connectionManager, printer, out, err);
            ExerciseReport report = runner.runSection(BasicOperationsLab.TITLE, exercises, runIgnored);
            return report.hasFailures() ? 1 : 0;
        } catch (Exception e) {
            // Only print stack trace in debug mode, otherwise just print the error message
            if (debug) {
                err.println("Error (debug mode): ");
                e.printStackTrace(err);
            } else {
                err.println("Error: " + e.getMessage());
            }
            logger.debug("Lab run aborted", e);
            return 1;
        }
    }

    /**
     * Builds the connection configuration from the parsed options.
     * @return the connection configuration
     */
    public ConnectionConfig toConnectionConfig() {
        return new ConnectionConfig(
            host,
            port,
            username,
            password,
            keyspace,
            localDatacenter,
            Duration.ofSeconds(connectTimeout),
            Duration.ofSeconds(requestTimeout)
        );
    }

    /**
     * Builds the lab settings from the parsed options.
     * @return the lab settings
     */
    public LabSettings toLabSettings() {
        return new LabSettings(labKeyspace, replicationFactor, expectedNodes);
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public List<String> getExercises() {
        return exercises;
    }

    public boolean isRunIgnored() {
        return runIgnored;
    }
}
