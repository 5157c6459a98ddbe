package com.pulsesystems.config;

/**
 * Configuration for an event router's queue and retry behaviour.
 */
public class EventRouterConfig {
    // Default values for router configuration
    public static final int DEFAULT_QUEUE_CAPACITY = 10_000;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_HANDLER_PRIORITY = 0;

    private int queueCapacity;
    private int maxRetries;
    private int defaultHandlerPriority;

    /**
     * Creates a new EventRouterConfig with default values.
     */
    public EventRouterConfig() {
        this.queueCapacity = DEFAULT_QUEUE_CAPACITY;
        this.maxRetries = DEFAULT_MAX_RETRIES;
        this.defaultHandlerPriority = DEFAULT_HANDLER_PRIORITY;
    }

    /**
     * Sets the maximum number of queued events. Emits beyond this are rejected.
     *
     * @param queueCapacity The capacity, at least 1
     * @return This EventRouterConfig instance
     */
    public EventRouterConfig setQueueCapacity(int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be positive, got " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
        return this;
    }

    /**
     * Sets the number of attempts after which a failing event is discarded.
     * A value of 3 means an always-failing event is attempted exactly three times.
     *
     * @param maxRetries The attempt bound, at least 1
     * @return This EventRouterConfig instance
     */
    public EventRouterConfig setMaxRetries(int maxRetries) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("Max retries must be positive, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
        return this;
    }

    /**
     * Sets the handler priority used when a registration does not specify one.
     *
     * @param defaultHandlerPriority The default priority
     * @return This EventRouterConfig instance
     */
    public EventRouterConfig setDefaultHandlerPriority(int defaultHandlerPriority) {
        this.defaultHandlerPriority = defaultHandlerPriority;
        return this;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getDefaultHandlerPriority() {
        return defaultHandlerPriority;
    }

    @Override
    public String toString() {
        return "EventRouterConfig{" +
                "queueCapacity=" + queueCapacity +
                ", maxRetries=" + maxRetries +
                ", defaultHandlerPriority=" + defaultHandlerPriority +
                '}';
    }
}
