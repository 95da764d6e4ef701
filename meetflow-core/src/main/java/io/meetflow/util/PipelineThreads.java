package io.meetflow.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The threads meetflow owns, named after the pipeline role they serve: {@code meetflow-worker}
 * for the polling loop, {@code meetflow-transcript-1}, {@code meetflow-transcript-2}, ... for a
 * pool. All are daemons, so a host that forgets to close the pipeline can still exit.
 *
 * <p>An uncaught error is logged at {@code SEVERE} under the thread's role.
 */
public final class PipelineThreads {
    private static final Logger logger = Logger.getLogger(PipelineThreads.class.getName());
    private static final String PREFIX = "meetflow-";

    private PipelineThreads() {
    }

    /**
     * An unstarted thread named {@code meetflow-<role>}.
     */
    public static Thread newThread(String role, Runnable task) {
        Objects.requireNonNull(task, "task");
        return configure(new Thread(task, PREFIX + checkRole(role)), role);
    }

    /**
     * A factory for the pool serving {@code role}; threads are numbered from 1.
     */
    public static ThreadFactory poolFactory(String role) {
        String base = PREFIX + checkRole(role) + "-";
        AtomicInteger counter = new AtomicInteger(1);
        return task -> configure(new Thread(task, base + counter.getAndIncrement()), role);
    }

    private static String checkRole(String role) {
        Objects.requireNonNull(role, "role");
        if (role.isEmpty() || role.startsWith(PREFIX) || role.endsWith("-")) {
            throw new IllegalArgumentException("role must be a bare name such as 'worker': " + role);
        }
        return role;
    }

    private static Thread configure(Thread thread, String role) {
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) ->
            logger.log(Level.SEVERE, "Uncaught error in " + role + " thread " + t.getName(), e));
        return thread;
    }
}
