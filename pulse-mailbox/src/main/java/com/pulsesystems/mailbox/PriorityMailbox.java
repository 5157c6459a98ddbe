package com.pulsesystems.mailbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.ToIntFunction;

/**
 * Bounded mailbox that orders messages by an integer rank, highest first.
 *
 * Messages of equal rank form a band and leave the mailbox in the order they were offered,
 * so an offer behaves like inserting before the first queued message of strictly lower rank.
 * Each band is a plain {@link ArrayDeque}; bands are kept in a {@link TreeMap} sorted by
 * descending rank, so offer and poll cost O(log bands) rather than a scan of the queue.
 *
 * All operations take a single lock. Offers never block: once {@link #capacity()} messages
 * are queued, further offers are rejected and counted.
 *
 * @param <T> The type of messages
 */
public class PriorityMailbox<T> implements Mailbox<T> {

    private static final Logger logger = LoggerFactory.getLogger(PriorityMailbox.class);

    private final TreeMap<Integer, ArrayDeque<T>> bands = new TreeMap<>(Comparator.reverseOrder());
    private final ToIntFunction<? super T> rank;
    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private int size;

    private final AtomicLong totalMessagesOffered = new AtomicLong();
    private final AtomicLong totalMessagesRejected = new AtomicLong();

    /**
     * Creates a bounded priority mailbox.
     *
     * @param capacity the maximum number of messages, at least 1
     * @param rank     extracts the ordering rank of a message; higher ranks leave first
     */
    public PriorityMailbox(int capacity, ToIntFunction<? super T> rank) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.rank = Objects.requireNonNull(rank, "rank cannot be null");
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        int messageRank = rank.applyAsInt(message);
        totalMessagesOffered.incrementAndGet();

        lock.lock();
        try {
            if (size >= capacity) {
                totalMessagesRejected.incrementAndGet();
                logger.trace("Mailbox full ({} messages), rejecting message of rank {}", size, messageRank);
                return false;
            }
            bands.computeIfAbsent(messageRank, r -> new ArrayDeque<>()).addLast(message);
            size++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T poll() {
        lock.lock();
        try {
            return pollLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T peek() {
        lock.lock();
        try {
            Map.Entry<Integer, ArrayDeque<T>> head = bands.firstEntry();
            return head == null ? null : head.getValue().peekFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "collection cannot be null");
        lock.lock();
        try {
            int transferred = 0;
            while (transferred < maxElements) {
                T message = pollLocked();
                if (message == null) {
                    break;
                }
                collection.add(message);
                transferred++;
            }
            return transferred;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<T> snapshot() {
        lock.lock();
        try {
            List<T> copy = new ArrayList<>(size);
            for (ArrayDeque<T> band : bands.values()) {
                copy.addAll(band);
            }
            return copy;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public int remainingCapacity() {
        lock.lock();
        try {
            return capacity - size;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            bands.clear();
            size = 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    /**
     * Gets the total number of offers made to this mailbox, accepted or not.
     *
     * @return total offers
     */
    public long getTotalMessagesOffered() {
        return totalMessagesOffered.get();
    }

    /**
     * Gets the number of offers rejected because the mailbox was full.
     *
     * @return total rejections
     */
    public long getTotalMessagesRejected() {
        return totalMessagesRejected.get();
    }

    // Caller must hold the lock
    private T pollLocked() {
        Iterator<Map.Entry<Integer, ArrayDeque<T>>> it = bands.entrySet().iterator();
        if (!it.hasNext()) {
            return null;
        }
        ArrayDeque<T> band = it.next().getValue();
        T message = band.pollFirst();
        if (band.isEmpty()) {
            it.remove();
        }
        size--;
        return message;
    }
}
