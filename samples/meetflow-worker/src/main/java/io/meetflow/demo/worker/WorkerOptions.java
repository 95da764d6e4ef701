package io.meetflow.demo.worker;

import java.util.Objects;

/**
 * Command line of {@link MeetflowWorker}.
 *
 * <pre>
 *   --jdbc-url=URL       database to work on (default: in-memory H2)
 *   --username=USER      database user
 *   --password=PASS      database password
 *   --init-schema        install the bundled DDL before starting (always on for H2)
 *   --demo               ingest a sample Zoom webhook at startup
 * </pre>
 */
record WorkerOptions(String jdbcUrl, String username, String password, boolean initSchema, boolean demo) {

    static final String DEFAULT_JDBC_URL = "jdbc:h2:mem:meetflow;DB_CLOSE_DELAY=-1";

    WorkerOptions {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    }

    static WorkerOptions parse(String... args) {
        String jdbcUrl = DEFAULT_JDBC_URL;
        String username = null;
        String password = null;
        boolean initSchema = false;
        boolean demo = false;
        for (String arg : args) {
            if (arg.startsWith("--jdbc-url=")) {
                jdbcUrl = value(arg);
            } else if (arg.startsWith("--username=")) {
                username = value(arg);
            } else if (arg.startsWith("--password=")) {
                password = value(arg);
            } else if (arg.equals("--init-schema")) {
                initSchema = true;
            } else if (arg.equals("--demo")) {
                demo = true;
            } else {
                throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        if (jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("--jdbc-url must not be empty");
        }
        return new WorkerOptions(jdbcUrl, username, password, initSchema || jdbcUrl.startsWith("jdbc:h2:"), demo);
    }

    private static String value(String arg) {
        return arg.substring(arg.indexOf('=') + 1);
    }
}
