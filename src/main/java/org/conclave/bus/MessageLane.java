package org.conclave.bus;

import org.conclave.bus.api.Message;
import org.conclave.bus.api.Priority;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A bounded FIFO queue of messages of a single {@link Priority}, guarded by its own lock so
 * that lanes never contend with each other.
 */
final class MessageLane {

    /**
     * Result of offering a message to a lane.
     */
    enum OfferResult {
        ACCEPTED,
        ACCEPTED_AFTER_EVICTION,
        REJECTED
    }

    private final Priority priority;
    private final int capacity;
    private final ArrayDeque<Message> queue;
    private final ReentrantLock lock = new ReentrantLock();

    MessageLane(Priority priority, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity of lane " + priority + " must be positive.");
        }
        this.priority = priority;
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(Math.min(capacity, 64));
    }

    /**
     * Appends a message, applying the lane's overflow policy when it is full: urgent lanes drop
     * their oldest entry, the others refuse the new message.
     */
    OfferResult offer(Message message) {
        lock.lock();
        try {
            if (queue.size() < capacity) {
                queue.addLast(message);
                return OfferResult.ACCEPTED;
            }
            if (priority.evictsOnOverflow()) {
                queue.pollFirst();
                queue.addLast(message);
                return OfferResult.ACCEPTED_AFTER_EVICTION;
            }
            return OfferResult.REJECTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves up to {@code maxElements} messages, oldest first, into {@code target}.
     *
     * @return The number of messages moved.
     */
    int drainTo(Collection<? super Message> target, int maxElements) {
        lock.lock();
        try {
            int count = 0;
            while (count < maxElements && !queue.isEmpty()) {
                target.add(queue.pollFirst());
                count++;
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    int clear() {
        lock.lock();
        try {
            int size = queue.size();
            queue.clear();
            return size;
        } finally {
            lock.unlock();
        }
    }
}
