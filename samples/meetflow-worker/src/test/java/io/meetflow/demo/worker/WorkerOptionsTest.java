package io.meetflow.demo.worker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerOptionsTest {

    @Test
    void defaultsToInMemoryH2WithSchema() {
        WorkerOptions options = WorkerOptions.parse();
        assertEquals(WorkerOptions.DEFAULT_JDBC_URL, options.jdbcUrl());
        assertNull(options.username());
        assertTrue(options.initSchema());
        assertFalse(options.demo());
    }

    @Test
    void parsesAllOptions() {
        WorkerOptions options = WorkerOptions.parse(
            "--jdbc-url=jdbc:postgresql://db:5432/meetflow",
            "--username=meetflow",
            "--password=a=b",
            "--demo");
        assertEquals("jdbc:postgresql://db:5432/meetflow", options.jdbcUrl());
        assertEquals("meetflow", options.username());
        assertEquals("a=b", options.password());
        assertFalse(options.initSchema());
        assertTrue(options.demo());

        assertTrue(WorkerOptions.parse("--jdbc-url=jdbc:postgresql://db/x", "--init-schema").initSchema());
    }

    @Test
    void rejectsUnknownOrEmptyOptions() {
        assertThrows(IllegalArgumentException.class, () -> WorkerOptions.parse("--verbose"));
        assertThrows(IllegalArgumentException.class, () -> WorkerOptions.parse("--jdbc-url="));
    }
}
