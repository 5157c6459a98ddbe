package com.pulsesystems.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for draining a router with a pool of workers instead of a single loop.
 */
public class WorkerPoolConfig {
    // Default values
    public static final int DEFAULT_WORKERS = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
    public static final Duration DEFAULT_HANDLER_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_THREAD_NAME_PREFIX = "pulse-worker";

    private int workers = DEFAULT_WORKERS;
    private Duration handlerTimeout = DEFAULT_HANDLER_TIMEOUT;
    private String threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;

    /**
     * Creates a new WorkerPoolConfig with default settings.
     */
    public WorkerPoolConfig() {
        // Use defaults
    }

    /**
     * Sets how many events may be processed at the same time.
     *
     * @param workers The number of workers, at least 1
     * @return This WorkerPoolConfig instance for method chaining
     */
    public WorkerPoolConfig setWorkers(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("Workers must be positive, got " + workers);
        }
        this.workers = workers;
        return this;
    }

    /**
     * Sets how long a single handler may run before the attempt is failed.
     *
     * @param handlerTimeout The timeout, strictly positive
     * @return This WorkerPoolConfig instance for method chaining
     */
    public WorkerPoolConfig setHandlerTimeout(Duration handlerTimeout) {
        Objects.requireNonNull(handlerTimeout, "handlerTimeout cannot be null");
        if (handlerTimeout.isZero() || handlerTimeout.isNegative()) {
            throw new IllegalArgumentException("Handler timeout must be positive, got " + handlerTimeout);
        }
        this.handlerTimeout = handlerTimeout;
        return this;
    }

    /**
     * Sets the name prefix for worker and handler threads.
     *
     * @param threadNamePrefix The prefix
     * @return This WorkerPoolConfig instance for method chaining
     */
    public WorkerPoolConfig setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix, "threadNamePrefix cannot be null");
        return this;
    }

    public int getWorkers() {
        return workers;
    }

    public Duration getHandlerTimeout() {
        return handlerTimeout;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }
}
