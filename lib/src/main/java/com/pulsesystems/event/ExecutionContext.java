package com.pulsesystems.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Correlation data carried by an event across handlers and follow-up events.
 *
 * @param correlationId id shared by every event of one logical operation
 * @param parentId      id of the event that caused this one, or null
 * @param sessionId     id of the user or agent session, or null
 * @param metadata      free-form ancillary values
 */
public record ExecutionContext(String correlationId, String parentId, String sessionId, Map<String, Object> metadata) {

    public ExecutionContext {
        Objects.requireNonNull(correlationId, "correlationId cannot be null");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Creates a context with a fresh correlation id and empty metadata.
     *
     * @return a new root context
     */
    public static ExecutionContext create() {
        return new ExecutionContext(UUID.randomUUID().toString(), null, null, Map.of());
    }

    /**
     * Derives the context for an event caused by {@code parent}: same correlation, session and metadata.
     *
     * @param parent the causing event
     * @return a child context
     */
    public ExecutionContext childOf(Event parent) {
        return new ExecutionContext(correlationId, parent.getId(), sessionId, metadata);
    }

    /**
     * Returns a copy of this context with one extra metadata entry.
     *
     * @param key   metadata key
     * @param value metadata value
     * @return a new context
     */
    public ExecutionContext withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new ExecutionContext(correlationId, parentId, sessionId, copy);
    }
}
