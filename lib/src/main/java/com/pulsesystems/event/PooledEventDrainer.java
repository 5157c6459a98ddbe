package com.pulsesystems.event;

import com.pulsesystems.config.WorkerPoolConfig;
import com.pulsesystems.dispatcher.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drains an {@link EventRouter} with several workers.
 *
 * <p>Up to {@link WorkerPoolConfig#getWorkers()} events are processed at once. Each event still runs
 * its handlers one after another, but every handler gets {@link WorkerPoolConfig#getHandlerTimeout()}
 * to finish; a handler that overruns is interrupted and the attempt fails with a
 * {@link HandlerTimeoutException}, going through the router's usual retry path.
 *
 * <p>Events leave the queue in priority order, but with more than one worker a lower-priority event
 * can finish before a higher-priority one. The drainer shares the router's single-flight guard, so
 * it never overlaps with {@link EventRouter#drain()}.
 */
public class PooledEventDrainer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PooledEventDrainer.class);

    private final EventRouter router;
    private final WorkerPoolConfig config;
    private final Dispatcher workers;
    private final Dispatcher handlerRunner;

    public PooledEventDrainer(EventRouter router, WorkerPoolConfig config) {
        this.router = Objects.requireNonNull(router, "router cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.workers = Dispatcher.fixedThreadPoolDispatcher(config.getWorkers(), config.getThreadNamePrefix());
        this.handlerRunner = Dispatcher.cachedThreadPoolDispatcher(config.getThreadNamePrefix() + "-handler");
    }

    /**
     * Processes queued events until the queue is empty.
     *
     * @return the number of events that reached {@link EventStatus#PROCESSED} during this call;
     *         0 if another drain pass was already running
     */
    public int drain() {
        if (!router.tryBeginDrain()) {
            logger.debug("Drain already in progress, skipping");
            return 0;
        }
        AtomicInteger processed = new AtomicInteger();
        try {
            int workerCount = config.getWorkers();
            CountDownLatch finished = new CountDownLatch(workerCount);
            for (int i = 0; i < workerCount; i++) {
                workers.schedule(() -> {
                    try {
                        drainLoop(processed);
                    } finally {
                        finished.countDown();
                    }
                });
            }
            finished.await();
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for drain workers");
            Thread.currentThread().interrupt();
        } finally {
            router.endDrain();
        }
        return processed.get();
    }

    private void drainLoop(AtomicInteger processed) {
        Event event;
        while (!Thread.currentThread().isInterrupted() && (event = router.pollNext()) != null) {
            try {
                router.processEvent(event, this::invokeWithTimeout);
                processed.incrementAndGet();
            } catch (EventProcessingException e) {
                router.retry(event);
            }
        }
    }

    private void invokeWithTimeout(HandlerRegistration registration, Event event) throws Exception {
        Duration timeout = config.getHandlerTimeout();
        Future<Void> invocation = handlerRunner.submit(() -> {
            registration.handler().handle(event);
            return null;
        });
        try {
            invocation.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            invocation.cancel(true);
            throw new HandlerTimeoutException(registration.id(), timeout);
        } catch (InterruptedException e) {
            invocation.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /**
     * Stops both thread pools. Queued events stay in the router.
     */
    @Override
    public void close() {
        workers.shutdown();
        handlerRunner.shutdown();
    }
}
