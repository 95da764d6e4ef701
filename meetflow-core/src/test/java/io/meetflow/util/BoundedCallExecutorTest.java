package io.meetflow.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundedCallExecutorTest {
    private final BoundedCallExecutor executor = new BoundedCallExecutor("bounded-test");

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void returnsResult() throws Exception {
        assertEquals("done", executor.call(() -> "done", 1000));
    }

    @Test
    void wrapsCallFailure() {
        ExecutionException e = assertThrows(ExecutionException.class,
            () -> executor.call(() -> {
                throw new IOException("HTTP 500");
            }, 1000));

        assertInstanceOf(IOException.class, e.getCause());
        assertEquals("HTTP 500", e.getCause().getMessage());
    }

    @Test
    void timeoutCancelsCall() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThrows(TimeoutException.class, () -> executor.call(() -> {
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return null;
        }, 50));

        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }

    @Test
    void interruptOfWaitingThreadCancelsCall() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch cancelled = new CountDownLatch(1);
        AtomicReference<Throwable> outcome = new AtomicReference<>();

        Thread waiter = new Thread(() -> {
            try {
                executor.call(() -> {
                    started.countDown();
                    try {
                        new CountDownLatch(1).await();
                    } catch (InterruptedException e) {
                        cancelled.countDown();
                        throw e;
                    }
                    return null;
                }, 10_000);
            } catch (Exception e) {
                outcome.set(e);
            }
        });
        waiter.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        waiter.interrupt();
        waiter.join(5000);

        assertInstanceOf(InterruptedException.class, outcome.get());
        assertTrue(cancelled.await(5, TimeUnit.SECONDS));
    }
}
