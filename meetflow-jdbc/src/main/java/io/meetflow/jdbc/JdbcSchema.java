package io.meetflow.jdbc;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Installs the bundled DDL for a dialect. Statements use {@code IF NOT EXISTS}, so installing
 * twice is harmless.
 *
 * <p>The bundled scripts create the default table names only.
 */
public final class JdbcSchema {
    private static final Logger logger = Logger.getLogger(JdbcSchema.class.getName());

    private JdbcSchema() {
    }

    public static void install(DataSource dataSource, Dialect dialect) {
        try (Connection conn = dataSource.getConnection()) {
            install(conn, dialect);
        } catch (SQLException e) {
            throw new StoreException("Failed to install schema for " + dialect.name(), e);
        }
    }

    public static void install(Connection conn, Dialect dialect) {
        List<String> statements = statements(dialect);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to install schema for " + dialect.name(), e);
        }
        logger.log(Level.INFO, "Installed {0} schema ({1} statements)",
            new Object[]{dialect.name(), statements.size()});
    }

    /**
     * Returns the DDL statements of the dialect's schema resource, without comments.
     *
     * @throws IllegalStateException if the resource is missing
     */
    public static List<String> statements(Dialect dialect) {
        return statements(dialect.schemaResource());
    }

    static List<String> statements(String resource) {
        String script;
        try (InputStream in = JdbcSchema.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Schema resource not found: " + resource);
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema resource: " + resource, e);
        }
        List<String> statements = new ArrayList<>();
        StringBuilder uncommented = new StringBuilder();
        for (String line : script.split("\n")) {
            if (!line.trim().startsWith("--")) {
                uncommented.append(line).append('\n');
            }
        }
        for (String sql : uncommented.toString().split(";")) {
            String trimmed = sql.trim();
            if (!trimmed.isEmpty()) {
                statements.add(trimmed);
            }
        }
        return statements;
    }
}
