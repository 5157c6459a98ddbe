package com.pulsesystems.event;

import com.pulsesystems.config.WorkerPoolConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PooledEventDrainer.
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class PooledEventDrainerTest {

    private final EventRouter router = new EventRouter();
    private PooledEventDrainer drainer;

    @AfterEach
    void cleanup() {
        if (drainer != null) {
            drainer.close();
        }
    }

    private void emit(String type, int count) {
        for (int i = 0; i < count; i++) {
            assertTrue(router.emit(router.createEvent(type, "src-" + i, SourceType.AGENT, Map.of("n", i))));
        }
    }

    @Test
    void testDrainsEveryEvent() {
        drainer = new PooledEventDrainer(router, new WorkerPoolConfig().setWorkers(3));
        Set<Object> seen = ConcurrentHashMap.newKeySet();
        router.register("work", e -> seen.add(e.getPayload().get("n")));
        emit("work", 50);

        int processed = drainer.drain();

        assertEquals(50, processed);
        assertEquals(50, seen.size());
        assertEquals(0, router.queueLength());
        assertFalse(router.isDraining());
    }

    @Test
    void testWorkersProcessEventsConcurrently() {
        int workers = 4;
        drainer = new PooledEventDrainer(router, new WorkerPoolConfig().setWorkers(workers));
        CyclicBarrier allRunning = new CyclicBarrier(workers);
        // Only passes if all four events are inside their handlers at the same time
        router.register("together", e -> allRunning.await(5, TimeUnit.SECONDS));
        emit("together", workers);

        assertEquals(workers, drainer.drain());
    }

    @Test
    void testHandlerTimeoutFailsAttemptAndRetries() {
        drainer = new PooledEventDrainer(router, new WorkerPoolConfig()
            .setWorkers(1)
            .setHandlerTimeout(Duration.ofMillis(100)));
        AtomicInteger attempts = new AtomicInteger();
        router.register("hang", e -> {
            attempts.incrementAndGet();
            Thread.sleep(10_000);
        });
        Event event = router.createEvent("hang", "src", SourceType.MODULE, Map.of());
        router.emit(event);

        int processed = drainer.drain();

        assertEquals(0, processed);
        assertEquals(3, attempts.get());
        assertEquals(3, event.getRetryCount());
        assertInstanceOf(HandlerTimeoutException.class, event.getLastError());
        assertEquals(1, router.stats().discarded());
    }

    @Test
    void testHandlerFailureUsesRouterRetryPath() {
        drainer = new PooledEventDrainer(router, new WorkerPoolConfig().setWorkers(2));
        AtomicInteger attempts = new AtomicInteger();
        router.register("flaky", e -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
        });
        Event event = router.createEvent("flaky", "src", SourceType.MODULE, Map.of());
        router.emit(event);

        assertEquals(1, drainer.drain());
        assertEquals(EventStatus.PROCESSED, event.getStatus());
        assertEquals(2, event.getRetryCount());
        assertInstanceOf(IllegalStateException.class, event.getLastError());
    }

    @Test
    void testHandlerErrorIsRetriedLikeAnException() {
        drainer = new PooledEventDrainer(router, new WorkerPoolConfig().setWorkers(1));
        AtomicInteger fineRuns = new AtomicInteger();
        router.register("bad", e -> {
            throw new AssertionError("handler error");
        });
        router.register("fine", e -> fineRuns.incrementAndGet());
        Event bad = router.createEvent("bad", "src", SourceType.MODULE, Map.of(), EventPriority.HIGH);
        router.emit(bad);
        emit("fine", 1);

        assertEquals(1, drainer.drain());
        assertEquals(1, fineRuns.get());
        assertEquals(EventStatus.FAILED, bad.getStatus());
        assertEquals(3, bad.getRetryCount());
        assertInstanceOf(AssertionError.class, bad.getLastError());
    }

    @Test
    void testInterruptedWorkerCancelsHandlerAndStopsItsLoop() throws Exception {
        String prefix = "interrupt-test";
        drainer = new PooledEventDrainer(router, new WorkerPoolConfig()
            .setWorkers(1)
            .setThreadNamePrefix(prefix)
            .setHandlerTimeout(Duration.ofSeconds(10)));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch handlerInterrupted = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        AtomicInteger blockAttempts = new AtomicInteger();
        AtomicInteger afterRuns = new AtomicInteger();
        router.register("block", e -> {
            if (blockAttempts.incrementAndGet() > 1) {
                return;
            }
            started.countDown();
            try {
                never.await();
            } catch (InterruptedException ie) {
                handlerInterrupted.countDown();
                throw ie;
            }
        });
        router.register("after", e -> afterRuns.incrementAndGet());
        Event blocked = router.createEvent("block", "src", SourceType.MODULE, Map.of(), EventPriority.HIGH);
        router.emit(blocked);
        emit("after", 1);

        AtomicInteger firstPass = new AtomicInteger(-1);
        Thread drainThread = new Thread(() -> firstPass.set(drainer.drain()));
        drainThread.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        Thread worker = Thread.getAllStackTraces().keySet().stream()
            .filter(t -> t.getName().startsWith(prefix + "-") && !t.getName().startsWith(prefix + "-handler"))
            .findFirst()
            .orElseThrow();
        worker.interrupt();

        assertTrue(handlerInterrupted.await(5, TimeUnit.SECONDS));
        drainThread.join(5_000);
        assertEquals(0, firstPass.get());
        assertEquals(EventStatus.FAILED, blocked.getStatus());
        assertEquals(1, blocked.getRetryCount());
        assertEquals(0, afterRuns.get());
        assertEquals(2, router.queueLength());

        assertEquals(2, drainer.drain());
        assertEquals(1, afterRuns.get());
        assertEquals(EventStatus.PROCESSED, blocked.getStatus());
    }

    @Test
    void testSharesSingleFlightGuardWithSequentialDrain() throws Exception {
        drainer = new PooledEventDrainer(router, new WorkerPoolConfig().setWorkers(2));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        router.register("slow", e -> {
            entered.countDown();
            release.await();
        });
        emit("slow", 2);

        Thread sequential = new Thread(router::drain);
        sequential.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertEquals(0, drainer.drain());
        assertEquals(1, router.queueLength());

        release.countDown();
        sequential.join(5_000);
        assertEquals(0, router.queueLength());
    }
}
