package com.pulsesystems.event;

import com.pulsesystems.KernelException;

/**
 * Raised by {@link EventRouter#processEvent(Event)} when a handler fails.
 * The handler's own exception is the cause; the unit id is the event id.
 */
public class EventProcessingException extends KernelException {

    private final String eventType;
    private final String handlerId;

    public EventProcessingException(Event event, String handlerId, Throwable cause) {
        super("Event processing error (" + event.getEventType() + ") in handler " + handlerId
                + ": " + cause.getMessage(), cause, event.getId());
        this.eventType = event.getEventType();
        this.handlerId = handlerId;
    }

    public String getEventType() {
        return eventType;
    }

    public String getHandlerId() {
        return handlerId;
    }
}
