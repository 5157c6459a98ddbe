package com.pulsesystems.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A prioritized unit of work routed to matching handlers.
 *
 * <p>Identity fields are fixed at creation. Status, retry count and processing time are updated
 * by the router only; an event keeps the same id across every retry and its retry count never
 * goes down.
 */
public final class Event {

    private final String id;
    private final Instant timestamp;
    private final String eventType;
    private final String sourceId;
    private final SourceType sourceType;
    private final EventPriority priority;
    private final Map<String, Object> payload;
    private final ExecutionContext executionContext;

    private volatile EventStatus status = EventStatus.PENDING;
    private volatile int retryCount;
    private volatile Instant processedAt;
    private volatile Throwable lastError;

    Event(String id,
          Instant timestamp,
          String eventType,
          String sourceId,
          SourceType sourceType,
          EventPriority priority,
          Map<String, Object> payload,
          ExecutionContext executionContext) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp cannot be null");
        this.eventType = Objects.requireNonNull(eventType, "eventType cannot be null");
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId cannot be null");
        this.sourceType = Objects.requireNonNull(sourceType, "sourceType cannot be null");
        this.priority = Objects.requireNonNull(priority, "priority cannot be null");
        this.payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.executionContext = Objects.requireNonNull(executionContext, "executionContext cannot be null");
    }

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getEventType() {
        return eventType;
    }

    public String getSourceId() {
        return sourceId;
    }

    public SourceType getSourceType() {
        return sourceType;
    }

    public EventPriority getPriority() {
        return priority;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public ExecutionContext getExecutionContext() {
        return executionContext;
    }

    public EventStatus getStatus() {
        return status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    /**
     * Gets the time the event reached {@link EventStatus#PROCESSED}.
     *
     * @return the processing time, or null if not processed
     */
    public Instant getProcessedAt() {
        return processedAt;
    }

    /**
     * Gets the handler failure from the most recent failed attempt.
     *
     * @return the failure, or null if no attempt has failed
     */
    public Throwable getLastError() {
        return lastError;
    }

    void markProcessing() {
        status = EventStatus.PROCESSING;
    }

    void markProcessed(Instant when) {
        processedAt = when;
        status = EventStatus.PROCESSED;
    }

    // Only one thread processes a given event at a time, so the increment is not contended
    void markFailed(Throwable error) {
        lastError = error;
        retryCount = retryCount + 1;
        status = EventStatus.FAILED;
    }

    @Override
    public String toString() {
        return "Event{" +
                "id='" + id + '\'' +
                ", eventType='" + eventType + '\'' +
                ", sourceId='" + sourceId + '\'' +
                ", priority=" + priority +
                ", status=" + status +
                ", retryCount=" + retryCount +
                '}';
    }
}
