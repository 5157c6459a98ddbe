package com.pulsesystems.dispatcher;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Dispatcher.
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class DispatcherTest {

    private Dispatcher dispatcher;

    @AfterEach
    void cleanup() {
        if (dispatcher != null && !dispatcher.isShutdown()) {
            dispatcher.shutdown();
            dispatcher.awaitTermination(2, TimeUnit.SECONDS);
        }
    }

    @Test
    void testScheduleRunsOnNamedDaemonThreads() throws InterruptedException {
        dispatcher = Dispatcher.fixedThreadPoolDispatcher(2, "test-pool");
        Set<String> names = ConcurrentHashMap.newKeySet();
        Set<Boolean> daemon = ConcurrentHashMap.newKeySet();
        CountDownLatch latch = new CountDownLatch(10);

        for (int i = 0; i < 10; i++) {
            dispatcher.schedule(() -> {
                names.add(Thread.currentThread().getName());
                daemon.add(Thread.currentThread().isDaemon());
                latch.countDown();
            });
        }

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertTrue(names.size() <= 2);
        assertTrue(names.stream().allMatch(n -> n.startsWith("test-pool-")));
        assertEquals(Set.of(true), daemon);
    }

    @Test
    void testSubmitReturnsResult() throws Exception {
        dispatcher = Dispatcher.cachedThreadPoolDispatcher("cached");

        Future<String> result = dispatcher.submit(() -> "done");

        assertEquals("done", result.get(5, TimeUnit.SECONDS));
        assertEquals("cached", dispatcher.getName());
    }

    @Test
    void testShutdownRejectsNewWork() {
        dispatcher = Dispatcher.fixedThreadPoolDispatcher(1, "closing");

        dispatcher.shutdown();
        dispatcher.shutdown(); // Second call is a no-op

        assertTrue(dispatcher.isShutdown());
        assertTrue(dispatcher.awaitTermination(2, TimeUnit.SECONDS));
        assertThrows(RejectedExecutionException.class, () -> dispatcher.schedule(() -> {}));
        assertThrows(RejectedExecutionException.class, () -> dispatcher.submit(() -> 1));
    }

    @Test
    void testNonPositiveThreadCountFallsBackToOne() throws Exception {
        dispatcher = Dispatcher.fixedThreadPoolDispatcher(0, "tiny");

        assertEquals(42, dispatcher.submit(() -> 42).get(5, TimeUnit.SECONDS));
    }
}
