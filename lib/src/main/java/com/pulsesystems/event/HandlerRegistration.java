package com.pulsesystems.event;

import java.util.Comparator;

/**
 * A handler bound to an event type filter.
 *
 * @param id        unique registration id
 * @param eventType exact type to match, or {@link EventTypes#ALL}
 * @param handler   the callback
 * @param priority  invocation order among handlers of one event, higher first; unrelated to event priority
 * @param sequence  registration order, used to break priority ties
 */
public record HandlerRegistration(String id, String eventType, EventHandler handler, int priority, long sequence) {

    /** Higher priority first, then earlier registration first. */
    static final Comparator<HandlerRegistration> INVOCATION_ORDER =
            Comparator.comparingInt(HandlerRegistration::priority).reversed()
                    .thenComparingLong(HandlerRegistration::sequence);

    /**
     * Checks whether this registration wants events of the given type.
     *
     * @param type the event type
     * @return true for a wildcard registration or an exact match
     */
    public boolean matches(String type) {
        return EventTypes.ALL.equals(eventType) || eventType.equals(type);
    }
}
