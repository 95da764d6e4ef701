package io.meetflow.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * The databases the stores run on.
 *
 * <p>All stores share one portable SQL text. The dialect covers the two places where databases
 * differ for meetflow: how a redelivered webhook's raw-event insert is skipped, and which DDL
 * script creates the tables.
 *
 * <p>The dialect is chosen by {@link DatabaseMetaData#getDatabaseProductName()}, which pooled
 * and proxied data sources report unchanged.
 */
public enum Dialect {
    H2("H2"),

    /**
     * Skips duplicates in SQL so that a redelivery does not abort the enclosing transaction.
     */
    POSTGRESQL("PostgreSQL") {
        @Override
        String ignoringDuplicates(String insertSql) {
            return insertSql + " ON CONFLICT DO NOTHING";
        }
    },

    /**
     * Also used for MariaDB and TiDB, which report through the MySQL protocol.
     */
    MYSQL("MySQL", "MariaDB") {
        // MySQL reports duplicates as the generic integrity state 23000; ER_DUP_ENTRY is 1062
        @Override
        boolean isDuplicateKey(SQLException e) {
            return anyInChain(e, current -> current.getErrorCode() == 1062);
        }
    };

    private static final String UNIQUE_VIOLATION = "23505";

    private final List<String> productNames;

    Dialect(String... productNames) {
        this.productNames = List.of(productNames);
    }

    /**
     * Classpath location of the DDL script that creates the default tables.
     */
    public String schemaResource() {
        return "schema/" + name().toLowerCase(Locale.ROOT) + ".sql";
    }

    /**
     * Rewrites a plain {@code INSERT} so that a duplicate key inserts nothing. The default leaves
     * the statement unchanged and relies on {@link #isDuplicateKey}.
     */
    String ignoringDuplicates(String insertSql) {
        return insertSql;
    }

    /**
     * Whether {@code e}, or an exception chained to it, reports a unique-key violation.
     */
    boolean isDuplicateKey(SQLException e) {
        return anyInChain(e, current -> UNIQUE_VIOLATION.equals(current.getSQLState()));
    }

    /**
     * Looks up the dialect for a database product name, ignoring case.
     *
     * @throws IllegalArgumentException if no dialect supports the product
     */
    public static Dialect forProductName(String productName) {
        if (productName == null || productName.isEmpty()) {
            throw new IllegalArgumentException("Database product name cannot be null or empty");
        }
        for (Dialect dialect : values()) {
            for (String candidate : dialect.productNames) {
                if (candidate.equalsIgnoreCase(productName.trim())) {
                    return dialect;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported database: " + productName
            + ". Supported: " + Arrays.toString(values()));
    }

    /**
     * Detects the dialect of the database behind {@code dataSource}.
     *
     * @throws IllegalStateException if the database cannot be reached or is not supported
     */
    public static Dialect detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        String productName;
        try (Connection conn = dataSource.getConnection()) {
            productName = conn.getMetaData().getDatabaseProductName();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect dialect from DataSource", e);
        }
        try {
            return forProductName(productName);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    private static boolean anyInChain(SQLException e, Predicate<SQLException> predicate) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            if (predicate.test(current)) {
                return true;
            }
            if (current.getCause() instanceof SQLException cause && predicate.test(cause)) {
                return true;
            }
        }
        return false;
    }
}
