package io.meetflow.jdbc;

import java.util.Objects;

/**
 * Names of the five pipeline tables.
 *
 * <p>Every name must match {@code [a-zA-Z_][a-zA-Z0-9_]*}; names are concatenated into SQL.
 */
public record TableNames(
    String rawEvents,
    String meetings,
    String transcripts,
    String webhookFailures,
    String deadLetters
) {
    public static final TableNames DEFAULTS =
        new TableNames("raw_events", "meetings", "transcripts", "webhook_failures", "dead_letters");

    private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

    public TableNames {
        validate(rawEvents);
        validate(meetings);
        validate(transcripts);
        validate(webhookFailures);
        validate(deadLetters);
    }

    /**
     * Returns the default names with {@code prefix} prepended, e.g. {@code mf_raw_events}.
     */
    public static TableNames withPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        return new TableNames(prefix + DEFAULTS.rawEvents, prefix + DEFAULTS.meetings,
            prefix + DEFAULTS.transcripts, prefix + DEFAULTS.webhookFailures, prefix + DEFAULTS.deadLetters);
    }

    public static String validate(String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (!tableName.matches(TABLE_NAME_PATTERN)) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        return tableName;
    }
}
