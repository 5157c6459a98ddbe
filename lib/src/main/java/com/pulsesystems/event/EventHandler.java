package com.pulsesystems.event;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Callback invoked for each matching event.
 * Throwing marks the event as failed and stops the remaining handlers for that attempt.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(Event event) throws Exception;

    /**
     * Adapts an asynchronous callback. The returned handler waits for the stage to complete, so the
     * router does not move on until the asynchronous work has finished; a stage that completes
     * exceptionally fails the event with the original cause.
     *
     * @param handler the asynchronous callback
     * @return a handler that blocks until the callback's stage completes
     */
    static EventHandler async(Function<? super Event, ? extends CompletionStage<?>> handler) {
        return event -> {
            try {
                handler.apply(event).toCompletableFuture().get();
            } catch (ExecutionException | CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof Exception exception) {
                    throw exception;
                }
                throw e;
            }
        };
    }
}
