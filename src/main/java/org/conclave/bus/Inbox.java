package org.conclave.bus;

import org.conclave.bus.api.Message;
import org.conclave.bus.api.MessageType;
import org.conclave.bus.api.Priority;
import org.conclave.bus.api.UnitRegistration;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The inbound queues of one registered unit: one bounded {@link MessageLane} per priority.
 * <p>
 * Producers only ever append (each lane under its own lock); the owning unit only ever drains.
 * Arrivals bump a sequence number under {@code arrivalLock} so that a waiting poller cannot
 * miss a message that lands between its drain attempt and its wait.
 */
final class Inbox {

    private final String owner;
    private final Set<MessageType> subscriptions;
    private final Map<Priority, MessageLane> lanes = new EnumMap<>(Priority.class);
    private final Instant registeredAt = Instant.now();
    private volatile Instant lastHeartbeat = registeredAt;
    private volatile boolean discarded;

    private final ReentrantLock arrivalLock = new ReentrantLock();
    private final Condition arrived = arrivalLock.newCondition();
    private long arrivals;

    Inbox(String owner, Set<MessageType> subscriptions, Map<Priority, Integer> capacities) {
        this.owner = owner;
        this.subscriptions = subscriptions.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(MessageType.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(subscriptions));
        for (Priority priority : Priority.values()) {
            lanes.put(priority, new MessageLane(priority, capacities.get(priority)));
        }
    }

    boolean accepts(Message message) {
        return subscriptions.contains(message.type())
                && (message.isBroadcast() || message.recipient().equals(owner));
    }

    MessageLane.OfferResult offer(Message message) {
        MessageLane.OfferResult result = lanes.get(message.priority()).offer(message);
        if (result != MessageLane.OfferResult.REJECTED) {
            arrivalLock.lock();
            try {
                arrivals++;
                arrived.signalAll();
            } finally {
                arrivalLock.unlock();
            }
        }
        return result;
    }

    /**
     * Drains the lanes in priority order, waiting up to {@code timeoutNanos} for something to
     * arrive if all lanes are empty.
     */
    List<Message> drain(long timeoutNanos, int maxMessages) throws InterruptedException {
        long remaining = timeoutNanos;
        while (true) {
            long seen = currentArrivals();
            List<Message> batch = drainNow(maxMessages);
            if (!batch.isEmpty() || remaining <= 0 || discarded) {
                return batch;
            }
            arrivalLock.lockInterruptibly();
            try {
                while (arrivals == seen && remaining > 0) {
                    remaining = arrived.awaitNanos(remaining);
                }
            } finally {
                arrivalLock.unlock();
            }
        }
    }

    private List<Message> drainNow(int maxMessages) {
        List<Message> batch = new ArrayList<>();
        for (Priority priority : Priority.values()) {
            int room = maxMessages - batch.size();
            if (room <= 0) {
                break;
            }
            lanes.get(priority).drainTo(batch, room);
        }
        return batch;
    }

    private long currentArrivals() {
        arrivalLock.lock();
        try {
            return arrivals;
        } finally {
            arrivalLock.unlock();
        }
    }

    /**
     * Wakes up any waiting poller without delivering anything.
     */
    void wakeUp() {
        arrivalLock.lock();
        try {
            arrivals++;
            arrived.signalAll();
        } finally {
            arrivalLock.unlock();
        }
    }

    /**
     * Empties all lanes and releases any waiting poller. The inbox accepts no further waits.
     *
     * @return The number of messages that were still queued.
     */
    int discard() {
        discarded = true;
        int lost = 0;
        for (MessageLane lane : lanes.values()) {
            lost += lane.clear();
        }
        wakeUp();
        return lost;
    }

    void touch() {
        lastHeartbeat = Instant.now();
    }

    String getOwner() {
        return owner;
    }

    UnitRegistration snapshot() {
        Map<Priority, Integer> backlog = new EnumMap<>(Priority.class);
        lanes.forEach((priority, lane) -> backlog.put(priority, lane.size()));
        return new UnitRegistration(owner, subscriptions, registeredAt, lastHeartbeat, Collections.unmodifiableMap(backlog));
    }
}
