package com.pulsesystems.event;

/**
 * Point-in-time counters for one router.
 *
 * @param pending          events currently queued
 * @param processing       events whose handlers are running right now
 * @param processed        events that reached {@link EventStatus#PROCESSED}
 * @param failed           failed attempts, counting every retry
 * @param discarded        events dropped after exhausting retries or when a retry could not be re-queued
 * @param rejected         emits refused because the queue was full
 * @param totalProcessed   processed plus discarded, i.e. events that left the router for good
 * @param averageLatencyMs mean time from event creation to completion, over processed events
 */
public record EventQueueStats(
        int pending,
        int processing,
        long processed,
        long failed,
        long discarded,
        long rejected,
        long totalProcessed,
        double averageLatencyMs) {
}
