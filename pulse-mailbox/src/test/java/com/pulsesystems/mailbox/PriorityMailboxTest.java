package com.pulsesystems.mailbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PriorityMailbox covering:
 * - Band ordering and FIFO within a band
 * - Capacity limits and rejection accounting
 * - Snapshot isolation
 * - Concurrent producers
 */
class PriorityMailboxTest {

    record Msg(String name, int rank) {}

    private static PriorityMailbox<Msg> mailbox(int capacity) {
        return new PriorityMailbox<>(capacity, Msg::rank);
    }

    @Test
    void testOfferRejectsNull() {
        PriorityMailbox<Msg> mailbox = mailbox(4);
        assertThrows(NullPointerException.class, () -> mailbox.offer(null));
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> mailbox(0));
    }

    @Test
    void testHigherRankLeavesFirst() {
        PriorityMailbox<Msg> mailbox = mailbox(10);

        mailbox.offer(new Msg("normal", 50));
        mailbox.offer(new Msg("critical", 100));
        mailbox.offer(new Msg("low", 25));
        mailbox.offer(new Msg("high", 75));

        assertEquals("critical", mailbox.poll().name());
        assertEquals("high", mailbox.poll().name());
        assertEquals("normal", mailbox.poll().name());
        assertEquals("low", mailbox.poll().name());
        assertNull(mailbox.poll());
    }

    @Test
    void testEqualRankKeepsOfferOrder() {
        PriorityMailbox<Msg> mailbox = mailbox(10);

        mailbox.offer(new Msg("first", 50));
        mailbox.offer(new Msg("urgent", 100));
        mailbox.offer(new Msg("second", 50));
        mailbox.offer(new Msg("third", 50));

        List<String> order = new ArrayList<>();
        Msg msg;
        while ((msg = mailbox.poll()) != null) {
            order.add(msg.name());
        }
        assertEquals(List.of("urgent", "first", "second", "third"), order);
    }

    @Test
    void testBoundedCapacity() {
        PriorityMailbox<Msg> mailbox = mailbox(2);

        assertTrue(mailbox.offer(new Msg("msg1", 1)));
        assertTrue(mailbox.offer(new Msg("msg2", 1)));
        assertFalse(mailbox.offer(new Msg("msg3", 100))); // Full, rank does not matter

        assertEquals(2, mailbox.size());
        assertEquals(0, mailbox.remainingCapacity());
        assertEquals(1, mailbox.getTotalMessagesRejected());
        assertEquals(3, mailbox.getTotalMessagesOffered());

        assertEquals("msg1", mailbox.poll().name());
        assertTrue(mailbox.offer(new Msg("msg3", 100)));
        assertEquals("msg3", mailbox.peek().name());
    }

    @Test
    void testSnapshotIsDefensiveCopy() {
        PriorityMailbox<Msg> mailbox = mailbox(10);
        mailbox.offer(new Msg("a", 1));
        mailbox.offer(new Msg("b", 2));

        List<Msg> snapshot = mailbox.snapshot();
        snapshot.clear();

        assertEquals(2, mailbox.size());
        assertEquals(List.of("b", "a"), mailbox.snapshot().stream().map(Msg::name).toList());
    }

    @Test
    void testClearEmptiesEveryBand() {
        PriorityMailbox<Msg> mailbox = mailbox(10);
        mailbox.offer(new Msg("a", 1));
        mailbox.offer(new Msg("b", 2));
        mailbox.offer(new Msg("c", 3));

        mailbox.clear();

        assertTrue(mailbox.isEmpty());
        assertNull(mailbox.poll());
        assertNull(mailbox.peek());
        assertEquals(10, mailbox.remainingCapacity());
    }

    @Test
    void testDrainToRespectsLimitAndOrder() {
        PriorityMailbox<Msg> mailbox = mailbox(10);
        for (int i = 0; i < 5; i++) {
            mailbox.offer(new Msg("m" + i, i % 2));
        }

        List<Msg> drained = new ArrayList<>();
        int count = mailbox.drainTo(drained, 3);

        assertEquals(3, count);
        assertEquals(List.of("m1", "m3", "m0"), drained.stream().map(Msg::name).toList());
        assertEquals(2, mailbox.size());
    }

    @Test
    @Timeout(10)
    void testConcurrentOffersNeverExceedCapacity() throws Exception {
        int capacity = 500;
        PriorityMailbox<Msg> mailbox = mailbox(capacity);
        int producers = 8;
        int perProducer = 200;
        ExecutorService executor = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();

        try {
            for (int p = 0; p < producers; p++) {
                int producer = p;
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        if (mailbox.offer(new Msg(producer + "-" + i, i % 4))) {
                            accepted.incrementAndGet();
                        }
                    }
                    return null;
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(capacity, accepted.get());
        assertEquals(capacity, mailbox.size());
        assertEquals(producers * perProducer - capacity, mailbox.getTotalMessagesRejected());
    }
}
