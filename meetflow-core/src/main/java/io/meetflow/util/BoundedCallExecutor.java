package io.meetflow.util;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs blocking external calls on a cached daemon pool and waits at most a fixed time for each.
 *
 * <p>On timeout or interruption of the waiting thread, the call is cancelled with interruption.
 */
public final class BoundedCallExecutor implements AutoCloseable {
    private final ExecutorService executor;

    /**
     * @param role names the pool's threads, see {@link PipelineThreads#poolFactory}
     */
    public BoundedCallExecutor(String role) {
        this.executor = Executors.newCachedThreadPool(PipelineThreads.poolFactory(role));
    }

    /**
     * Executes {@code call} and returns its result.
     *
     * @throws TimeoutException     if the call did not finish within {@code timeoutMs}
     * @throws ExecutionException   if the call threw; the cause is the original exception
     * @throws InterruptedException if the waiting thread was interrupted
     */
    public <T> T call(Callable<T> call, long timeoutMs)
        throws TimeoutException, ExecutionException, InterruptedException {
        Future<T> future = executor.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
