package com.pulsesystems.mailbox;

import java.util.Collection;
import java.util.List;

/**
 * Abstraction for non-blocking mailbox operations.
 * This interface decouples the event router from specific queue implementations.
 * Admission is always a non-blocking decision: a full mailbox rejects, it never makes the caller wait.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Inserts the specified message into this mailbox if it is possible to do
     * so immediately without exceeding capacity, returning true upon success
     * and false if the mailbox is full.
     *
     * @param message the message to add
     * @return true if the message was added, false otherwise
     */
    boolean offer(T message);

    /**
     * Retrieves and removes the head of this mailbox, or returns null if empty.
     *
     * @return the head of this mailbox, or null if empty
     */
    T poll();

    /**
     * Retrieves, but does not remove, the head of this mailbox, or returns null if empty.
     *
     * @return the head of this mailbox, or null if empty
     */
    T peek();

    /**
     * Removes available messages from this mailbox and adds them to the
     * given collection, up to maxElements.
     *
     * @param collection the collection to transfer messages into
     * @param maxElements the maximum number of messages to transfer
     * @return the number of messages transferred
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    /**
     * Returns a copy of the current contents in dequeue order.
     * Changes to the returned list do not affect the mailbox.
     *
     * @return the queued messages, head first
     */
    List<T> snapshot();

    /**
     * Returns the number of messages in this mailbox.
     *
     * @return the number of messages
     */
    int size();

    /**
     * Returns true if this mailbox contains no messages.
     *
     * @return true if empty
     */
    boolean isEmpty();

    /**
     * Returns the number of additional messages this mailbox can accept.
     *
     * @return the remaining capacity
     */
    int remainingCapacity();

    /**
     * Removes all messages from this mailbox.
     */
    void clear();

    /**
     * Returns the maximum number of messages this mailbox can hold.
     *
     * @return the capacity
     */
    int capacity();
}
