package com.pulsesystems.test;

import com.pulsesystems.event.EventRouter;
import com.pulsesystems.event.SourceType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AsyncAssertionTest {

    @Test
    void testEventuallySucceedsOnceConditionHolds() {
        AtomicInteger counter = new AtomicInteger();
        new Thread(() -> {
            for (int i = 0; i < 5; i++) {
                counter.incrementAndGet();
            }
        }).start();

        AsyncAssertion.eventually(() -> counter.get() == 5, Duration.ofSeconds(2));
    }

    @Test
    void testEventuallyFailsAfterTimeout() {
        AssertionError error = assertThrows(AssertionError.class,
            () -> AsyncAssertion.eventually(() -> false, Duration.ofMillis(100)));

        assertTrue(error.getMessage().contains("did not become true"));
    }

    @Test
    void testAwaitValueReportsHistory() {
        AssertionError error = assertThrows(AssertionError.class,
            () -> AsyncAssertion.awaitValue(() -> "stuck", "moving", Duration.ofMillis(100)));

        assertTrue(error.getMessage().contains("[stuck]"));
    }

    @Test
    void testAwaitIdleReportsBusyRouter() throws Exception {
        EventRouter router = new EventRouter();
        CountDownLatch release = new CountDownLatch(1);
        router.register("block", e -> release.await());
        router.emit(router.createEvent("block", "src", SourceType.SYSTEM, Map.of()));
        router.emit(router.createEvent("block", "src", SourceType.SYSTEM, Map.of()));
        Thread drain = new Thread(router::drain);
        drain.start();

        try {
            AssertionError error = assertThrows(AssertionError.class,
                () -> AsyncAssertion.awaitIdle(router, Duration.ofMillis(150)));
            assertTrue(error.getMessage().contains("Router not idle"));
        } finally {
            release.countDown();
            drain.join(2_000);
        }

        AsyncAssertion.awaitIdle(router, Duration.ofSeconds(2));
    }
}
