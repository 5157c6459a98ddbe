package com.pulsesystems;

import com.pulsesystems.config.KernelConfig;
import com.pulsesystems.event.Event;
import com.pulsesystems.event.EventPriority;
import com.pulsesystems.event.EventRouter;
import com.pulsesystems.event.EventTypes;
import com.pulsesystems.event.PooledEventDrainer;
import com.pulsesystems.event.SourceType;
import com.pulsesystems.resolver.DependencyNode;
import com.pulsesystems.resolver.DependencyResolver;
import com.pulsesystems.resolver.ResolutionFailure;
import com.pulsesystems.resolver.ResolvedDependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * The kernel context: one dependency resolver and one event router, owned by whoever builds it.
 *
 * <p>There is no process-wide instance. Call sites receive the kernel they should use, and starting
 * over (for example between tests) means creating a new kernel.
 *
 * <pre>{@code
 * PulseKernel kernel = PulseKernel.create();
 * kernel.initialize(units, Map.of(
 *         "storage", router -> router.register("task:create", storageHandler),
 *         "scheduler", router -> router.register("*", auditHandler, 10)));
 * kernel.router().drain();
 * }</pre>
 */
public final class PulseKernel {

    private static final Logger logger = LoggerFactory.getLogger(PulseKernel.class);

    /** Source id used for events the kernel emits itself. */
    public static final String KERNEL_SOURCE_ID = "kernel";

    private final KernelConfig config;
    private final DependencyResolver resolver;
    private final EventRouter router;

    private PulseKernel(KernelConfig config) {
        this.config = config;
        this.resolver = new DependencyResolver();
        this.router = new EventRouter(config.getRouterConfig());
    }

    /**
     * Creates a kernel with default configuration.
     *
     * @return a fresh kernel
     */
    public static PulseKernel create() {
        return create(new KernelConfig());
    }

    /**
     * Creates a kernel with the given configuration.
     *
     * @param config router and worker pool settings
     * @return a fresh kernel
     */
    public static PulseKernel create(KernelConfig config) {
        return new PulseKernel(Objects.requireNonNull(config, "config cannot be null"));
    }

    public DependencyResolver resolver() {
        return resolver;
    }

    public EventRouter router() {
        return router;
    }

    public KernelConfig config() {
        return config;
    }

    /**
     * Creates a drainer that processes this kernel's events with the configured worker pool.
     * The caller owns the drainer and must close it.
     *
     * @return a new pooled drainer
     */
    public PooledEventDrainer pooledDrainer() {
        return new PooledEventDrainer(router, config.getWorkerPoolConfig());
    }

    /**
     * Orders the units, lets each one register its handlers in load order, then emits
     * {@code kernel:init} with the resolved order as payload.
     *
     * <p>If resolution fails, no registrar runs and nothing is emitted.
     *
     * @param units      the units and their dependencies
     * @param registrars per-unit registration callbacks; units without one are skipped
     * @return the load order, or the resolution failure
     */
    public Result<List<ResolvedDependency>, ResolutionFailure> initialize(
            List<DependencyNode> units,
            Map<String, Consumer<EventRouter>> registrars) {
        Result<List<ResolvedDependency>, ResolutionFailure> resolution = resolver.resolve(units);
        if (!resolution.isSuccess()) {
            logger.error("Kernel initialization aborted: {}", resolution.failure().describe());
            return resolution;
        }

        List<ResolvedDependency> order = resolution.getOrElse(List.of());
        for (ResolvedDependency unit : order) {
            Consumer<EventRouter> registrar = registrars.get(unit.id());
            if (registrar != null) {
                logger.debug("Registering handlers for {} (level {})", unit.id(), unit.level());
                registrar.accept(router);
            }
        }

        List<String> loadOrder = order.stream().map(ResolvedDependency::id).toList();
        Event init = router.createEvent(EventTypes.KERNEL_INIT, KERNEL_SOURCE_ID, SourceType.KERNEL,
                Map.of("loadOrder", loadOrder), EventPriority.CRITICAL);
        if (!router.emit(init)) {
            logger.warn("Could not emit {} event, queue full", EventTypes.KERNEL_INIT);
        }
        logger.info("Kernel initialized with {} units, {} handlers", order.size(), router.handlerCount());
        return resolution;
    }
}
