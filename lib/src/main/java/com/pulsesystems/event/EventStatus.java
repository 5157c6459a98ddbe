package com.pulsesystems.event;

/**
 * Lifecycle of an event inside the router.
 *
 * <ul>
 *   <li>{@link #PENDING} - created or queued, not yet picked up</li>
 *   <li>{@link #PROCESSING} - handlers are running</li>
 *   <li>{@link #PROCESSED} - every matching handler completed</li>
 *   <li>{@link #FAILED} - a handler failed on the last attempt</li>
 * </ul>
 */
public enum EventStatus {
    PENDING,
    PROCESSING,
    PROCESSED,
    FAILED
}
