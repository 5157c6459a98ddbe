package com.pulsesystems.dispatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatcher schedules work on a named pool of platform daemon threads.
 * Event drain workers and timed handler invocations both run on dispatchers.
 */
public final class Dispatcher {

    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    private final ExecutorService executor;
    private final String name;
    private volatile boolean shutdown = false;

    private Dispatcher(ExecutorService executor, String name) {
        this.executor = executor;
        this.name = name;
    }

    /**
     * Creates a dispatcher backed by a fixed-size thread pool.
     *
     * @param threads The number of threads in the pool
     * @param name The name prefix for threads
     * @return A new Dispatcher
     */
    public static Dispatcher fixedThreadPoolDispatcher(int threads, String name) {
        int poolSize = Math.max(1, threads);
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, namedDaemonThreads(name));
        logger.info("Created fixed thread pool dispatcher: {} with {} threads", name, poolSize);
        return new Dispatcher(executor, name);
    }

    /**
     * Creates a dispatcher that grows on demand and reuses idle threads.
     * Suited to short blocking tasks whose number is bounded by the caller.
     *
     * @param name The name prefix for threads
     * @return A new Dispatcher
     */
    public static Dispatcher cachedThreadPoolDispatcher(String name) {
        ExecutorService executor = Executors.newCachedThreadPool(namedDaemonThreads(name));
        logger.info("Created cached thread pool dispatcher: {}", name);
        return new Dispatcher(executor, name);
    }

    /**
     * Schedules a task for execution on the dispatcher's thread pool.
     *
     * @param task The task to run
     * @throws RejectedExecutionException if the dispatcher has been shut down
     */
    public void schedule(Runnable task) {
        if (shutdown) {
            throw new RejectedExecutionException("Dispatcher " + name + " is shut down");
        }
        executor.execute(task);
    }

    /**
     * Submits a task and returns a future for its result.
     *
     * @param task The task to run
     * @param <V> The result type
     * @return A future completing with the task's result
     * @throws RejectedExecutionException if the dispatcher has been shut down
     */
    public <V> Future<V> submit(Callable<V> task) {
        if (shutdown) {
            throw new RejectedExecutionException("Dispatcher " + name + " is shut down");
        }
        return executor.submit(task);
    }

    /**
     * Initiates shutdown of the dispatcher.
     * No new tasks will be accepted after this call.
     * Currently executing tasks will be allowed to complete.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("Shutting down dispatcher: {}", name);
        executor.shutdown();
    }

    /**
     * Waits for running tasks to finish after {@link #shutdown()}.
     *
     * @return true if all tasks terminated, false if timeout elapsed
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) {
        try {
            return executor.awaitTermination(timeout, unit);
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for dispatcher {} termination", name);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Returns whether this dispatcher has been shut down.
     *
     * @return true if shutdown has been initiated
     */
    public boolean isShutdown() {
        return shutdown;
    }

    public String getName() {
        return name;
    }

    private static ThreadFactory namedDaemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(name + "-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
