package com.pulsesystems.event;

/**
 * Handle returned by {@link EventRouter#register}. Unsubscribing removes exactly the registration
 * that produced it; later calls do nothing.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
