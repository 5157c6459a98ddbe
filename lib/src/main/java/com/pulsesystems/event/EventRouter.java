package com.pulsesystems.event;

import com.pulsesystems.config.EventRouterConfig;
import com.pulsesystems.mailbox.PriorityMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes events to registered handlers in priority order.
 *
 * <p>Events wait in a bounded queue ordered by {@link EventPriority}, first-in first-out within a
 * priority. {@link #emit(Event)} never blocks: a full queue rejects the event and returns false.
 *
 * <p>{@link #drain()} removes events one at a time and runs every matching handler sequentially,
 * highest registration priority first. A handler failure ends that attempt; the event is put back
 * into its priority band until it has failed {@link EventRouterConfig#getMaxRetries()} times, after
 * which it is discarded. Only one drain pass runs at a time: a call made while another pass is
 * active returns 0 immediately.
 *
 * <p>Handlers have no timeout here, so a handler that never returns stalls the drain loop.
 * {@link PooledEventDrainer} drains the same queue with several workers and a per-handler timeout.
 *
 * <p>The queue and handler registry belong to this instance; use one router per tenant.
 */
public class EventRouter {

    private static final Logger logger = LoggerFactory.getLogger(EventRouter.class);

    /**
     * Runs one handler for one event. The sequential loop calls the handler directly;
     * the pooled drainer wraps it with a timeout.
     */
    @FunctionalInterface
    interface HandlerInvoker {
        void invoke(HandlerRegistration registration, Event event) throws Exception;
    }

    private static final HandlerInvoker DIRECT = (registration, event) -> registration.handler().handle(event);

    private final EventRouterConfig config;
    private final PriorityMailbox<Event> queue;
    private final Object registryLock = new Object();
    private volatile List<HandlerRegistration> handlers = List.of();
    private final AtomicLong registrationSequence = new AtomicLong();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    private final AtomicInteger processing = new AtomicInteger();
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicLong failedAttempts = new AtomicLong();
    private final AtomicLong discardedCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();
    private final AtomicLong totalLatencyNanos = new AtomicLong();

    /**
     * Creates a router with default configuration.
     */
    public EventRouter() {
        this(new EventRouterConfig());
    }

    /**
     * Creates a router with the given configuration.
     *
     * @param config queue capacity, retry bound and default handler priority
     */
    public EventRouter(EventRouterConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.queue = new PriorityMailbox<>(config.getQueueCapacity(), event -> event.getPriority().value());
    }

    // ---- registration ----

    /**
     * Registers a handler with the configured default priority.
     *
     * @see #register(String, EventHandler, int)
     */
    public Subscription register(String eventType, EventHandler handler) {
        return register(eventType, handler, config.getDefaultHandlerPriority());
    }

    /**
     * Registers a handler for an exact event type or {@link EventTypes#ALL}.
     *
     * @param eventType the type to match, or {@code "*"} for every event
     * @param handler   the callback
     * @param priority  invocation order among the handlers of one event, higher first; ties run in
     *                  registration order
     * @return a subscription that removes exactly this registration
     */
    public Subscription register(String eventType, EventHandler handler, int priority) {
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");

        HandlerRegistration registration = new HandlerRegistration(
                UUID.randomUUID().toString(), eventType, handler, priority, registrationSequence.getAndIncrement());

        synchronized (registryLock) {
            List<HandlerRegistration> updated = new ArrayList<>(handlers);
            updated.add(registration);
            updated.sort(HandlerRegistration.INVOCATION_ORDER);
            handlers = List.copyOf(updated);
        }
        logger.debug("Registered handler {} for '{}' with priority {}", registration.id(), eventType, priority);

        AtomicBoolean active = new AtomicBoolean(true);
        return () -> {
            if (active.compareAndSet(true, false)) {
                unregister(registration.id());
            }
        };
    }

    private void unregister(String registrationId) {
        synchronized (registryLock) {
            List<HandlerRegistration> updated = new ArrayList<>(handlers);
            updated.removeIf(h -> h.id().equals(registrationId));
            handlers = List.copyOf(updated);
        }
        logger.debug("Unregistered handler {}", registrationId);
    }

    // ---- event creation ----

    public Event createEvent(String eventType, String sourceId, SourceType sourceType, Map<String, Object> payload) {
        return createEvent(eventType, sourceId, sourceType, payload, EventPriority.NORMAL, null);
    }

    public Event createEvent(String eventType,
                             String sourceId,
                             SourceType sourceType,
                             Map<String, Object> payload,
                             EventPriority priority) {
        return createEvent(eventType, sourceId, sourceType, payload, priority, null);
    }

    /**
     * Builds a pending event with a fresh id and timestamp. Nothing is queued until {@link #emit(Event)}.
     *
     * @param eventType        the event type tag
     * @param sourceId         id of the emitting component
     * @param sourceType       kind of the emitting component
     * @param payload          event data, copied
     * @param priority         queue priority
     * @param executionContext correlation data; null creates a fresh context
     * @return the new event, status {@link EventStatus#PENDING}, retry count 0
     */
    public Event createEvent(String eventType,
                             String sourceId,
                             SourceType sourceType,
                             Map<String, Object> payload,
                             EventPriority priority,
                             ExecutionContext executionContext) {
        return new Event(
                UUID.randomUUID().toString(),
                Instant.now(),
                eventType,
                sourceId,
                sourceType,
                priority == null ? EventPriority.NORMAL : priority,
                payload,
                executionContext == null ? ExecutionContext.create() : executionContext);
    }

    // ---- queue ----

    /**
     * Queues an event behind every event of the same or higher priority.
     *
     * @param event the event
     * @return true if queued, false if the queue was full (the queue is left unchanged)
     */
    public boolean emit(Event event) {
        Objects.requireNonNull(event, "event cannot be null");
        if (!queue.offer(event)) {
            rejectedCount.incrementAndGet();
            logger.error("Event queue overflow, dropping event: {}", event.getEventType());
            return false;
        }
        return true;
    }

    /**
     * Removes the next event: highest priority, earliest among equals.
     *
     * @return the event, or empty if the queue is empty
     */
    public Optional<Event> dequeue() {
        return Optional.ofNullable(queue.poll());
    }

    /**
     * Discards every queued event without running handlers.
     * An event already being processed is not affected.
     */
    public void clearQueue() {
        int dropped = queue.size();
        queue.clear();
        logger.debug("Cleared {} queued events", dropped);
    }

    public int queueLength() {
        return queue.size();
    }

    /**
     * Returns the queued events in dequeue order. The list is a copy.
     */
    public List<Event> queueSnapshot() {
        return queue.snapshot();
    }

    public int handlerCount() {
        return handlers.size();
    }

    public int capacity() {
        return queue.capacity();
    }

    public boolean isDraining() {
        return draining.get();
    }

    public EventRouterConfig getConfig() {
        return config;
    }

    // ---- processing ----

    /**
     * Runs every matching handler for one event, in handler priority order.
     *
     * @param event the event, usually just dequeued
     * @throws EventProcessingException if a handler throws any exception or error; later handlers are
     *                                  skipped, the event is marked {@link EventStatus#FAILED} and its
     *                                  retry count is incremented
     */
    public void processEvent(Event event) {
        processEvent(event, DIRECT);
    }

    void processEvent(Event event, HandlerInvoker invoker) {
        List<HandlerRegistration> matching = matchingHandlers(event.getEventType());
        event.markProcessing();
        processing.incrementAndGet();
        try {
            for (HandlerRegistration registration : matching) {
                try {
                    invoker.invoke(registration, event);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw fail(event, registration, e);
                } catch (OutOfMemoryError | InternalError e) {
                    // Recorded on the event, then rethrown
                    fail(event, registration, e);
                    throw e;
                } catch (Throwable e) {
                    throw fail(event, registration, e);
                }
            }
            Instant now = Instant.now();
            event.markProcessed(now);
            processedCount.incrementAndGet();
            totalLatencyNanos.addAndGet(Duration.between(event.getTimestamp(), now).toNanos());
        } finally {
            processing.decrementAndGet();
        }
    }

    private EventProcessingException fail(Event event, HandlerRegistration registration, Throwable cause) {
        event.markFailed(cause);
        failedAttempts.incrementAndGet();
        logger.error("Event processing error ({}), attempt {}: {}",
                event.getEventType(), event.getRetryCount(), cause.getMessage(), cause);
        return new EventProcessingException(event, registration.id(), cause);
    }

    /**
     * Processes queued events until the queue is empty, including events re-queued for retry.
     *
     * @return the number of events that reached {@link EventStatus#PROCESSED} during this call;
     *         0 if another drain pass was already running
     */
    public int drain() {
        if (!tryBeginDrain()) {
            logger.debug("Drain already in progress, skipping");
            return 0;
        }
        int processed = 0;
        try {
            Event event;
            while ((event = queue.poll()) != null) {
                try {
                    processEvent(event);
                    processed++;
                } catch (EventProcessingException e) {
                    retry(event);
                }
            }
        } finally {
            endDrain();
        }
        return processed;
    }

    /**
     * Puts a failed event back into its priority band if it has attempts left.
     *
     * @param event an event whose last attempt failed
     * @return true if re-queued, false if it was discarded
     */
    public boolean retry(Event event) {
        if (event.getRetryCount() >= config.getMaxRetries()) {
            discardedCount.incrementAndGet();
            logger.warn("Discarding event {} ({}) after {} failed attempts",
                    event.getId(), event.getEventType(), event.getRetryCount());
            return false;
        }
        if (!emit(event)) {
            discardedCount.incrementAndGet();
            logger.warn("Could not re-queue event {} ({}) for retry, queue full", event.getId(), event.getEventType());
            return false;
        }
        logger.debug("Re-queued event {} ({}) for retry, attempt {} of {}",
                event.getId(), event.getEventType(), event.getRetryCount() + 1, config.getMaxRetries());
        return true;
    }

    /**
     * Gets a snapshot of the router's counters.
     *
     * @return current statistics
     */
    public EventQueueStats stats() {
        long processed = processedCount.get();
        long discarded = discardedCount.get();
        double averageLatencyMs = processed == 0 ? 0.0 : totalLatencyNanos.get() / (double) processed / 1_000_000.0;
        return new EventQueueStats(
                queue.size(),
                processing.get(),
                processed,
                failedAttempts.get(),
                discarded,
                rejectedCount.get(),
                processed + discarded,
                averageLatencyMs);
    }

    Event pollNext() {
        return queue.poll();
    }

    boolean tryBeginDrain() {
        return draining.compareAndSet(false, true);
    }

    void endDrain() {
        draining.set(false);
    }

    private List<HandlerRegistration> matchingHandlers(String eventType) {
        List<HandlerRegistration> matching = new ArrayList<>();
        for (HandlerRegistration registration : handlers) {
            if (registration.matches(eventType)) {
                matching.add(registration);
            }
        }
        return matching;
    }
}
