package com.pulsesystems.config;

import java.util.Objects;

/**
 * Top-level configuration for a {@code PulseKernel}.
 */
public class KernelConfig {

    private EventRouterConfig routerConfig = new EventRouterConfig();
    private WorkerPoolConfig workerPoolConfig = new WorkerPoolConfig();

    public KernelConfig setRouterConfig(EventRouterConfig routerConfig) {
        this.routerConfig = Objects.requireNonNull(routerConfig, "routerConfig cannot be null");
        return this;
    }

    public KernelConfig setWorkerPoolConfig(WorkerPoolConfig workerPoolConfig) {
        this.workerPoolConfig = Objects.requireNonNull(workerPoolConfig, "workerPoolConfig cannot be null");
        return this;
    }

    public EventRouterConfig getRouterConfig() {
        return routerConfig;
    }

    public WorkerPoolConfig getWorkerPoolConfig() {
        return workerPoolConfig;
    }
}
