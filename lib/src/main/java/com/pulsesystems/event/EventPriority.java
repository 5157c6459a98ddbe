package com.pulsesystems.event;

/**
 * Urgency of an event. The queue hands out higher values first.
 */
public enum EventPriority {
    CRITICAL(100),
    HIGH(75),
    NORMAL(50),
    LOW(25);

    private final int value;

    EventPriority(int value) {
        this.value = value;
    }

    /**
     * Gets the numeric rank used for queue ordering.
     *
     * @return the rank, higher is more urgent
     */
    public int value() {
        return value;
    }
}
