package org.conclave.bus;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.conclave.bus.api.BusStatistics;
import org.conclave.bus.api.IMessageBus;
import org.conclave.bus.api.Message;
import org.conclave.bus.api.MessageType;
import org.conclave.bus.api.Priority;
import org.conclave.bus.api.SendResult;
import org.conclave.bus.api.UnitRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe, in-memory implementation of {@link IMessageBus}.
 * <p>
 * Every registered unit owns an {@link Inbox} of four bounded lanes. {@link #send(Message)}
 * resolves the matching inboxes once and appends the message to the lane of its priority in
 * each of them. A full Critical or High lane discards its own oldest entry to admit the new
 * message; a full Normal or Low lane refuses it and the refusal is counted as a drop.
 * <p>
 * Lane capacities are read from the {@code lanes} block of the options:
 * <pre>
 * lanes { critical = 100, high = 500, normal = 1000, low = 1000 }
 * </pre>
 * All counters belong to the instance, so independent buses never share state.
 */
public class InMemoryMessageBus implements IMessageBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final Map<Priority, Integer> laneCapacities = new EnumMap<>(Priority.class);
    private final Map<String, Inbox> inboxes = new ConcurrentHashMap<>();
    private final ReentrantLock registryLock = new ReentrantLock();
    private final Map<String, CompletableFuture<Object>> pendingResponses = new ConcurrentHashMap<>();
    private volatile boolean closed = false;

    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong responded = new AtomicLong();
    private final AtomicLong timedOut = new AtomicLong();

    /**
     * Creates a bus with the default lane capacities.
     */
    public InMemoryMessageBus() {
        this(ConfigFactory.empty());
    }

    /**
     * Creates a bus configured from the given options.
     *
     * @param options The bus block of the configuration.
     * @throws IllegalArgumentException if a lane capacity is missing, malformed or not positive.
     */
    public InMemoryMessageBus(Config options) {
        Config defaults = ConfigFactory.parseMap(Map.of(
                "lanes.critical", 100,
                "lanes.high", 500,
                "lanes.normal", 1000,
                "lanes.low", 1000
        ));
        Config finalConfig = options.withFallback(defaults);
        try {
            for (Priority priority : Priority.values()) {
                int capacity = finalConfig.getInt("lanes." + priority.name().toLowerCase(Locale.ROOT));
                if (capacity <= 0) {
                    throw new IllegalArgumentException("Capacity of lane " + priority + " must be positive.");
                }
                laneCapacities.put(priority, capacity);
            }
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for InMemoryMessageBus", e);
        }
        log.debug("Message bus created with lane capacities {}", laneCapacities);
    }

    @Override
    public boolean register(String name, Set<MessageType> subscriptions) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Unit name must not be empty");
        }
        registryLock.lock();
        try {
            if (closed) {
                log.debug("Refusing registration of '{}': bus is closed", name);
                return false;
            }
            if (inboxes.containsKey(name)) {
                log.debug("Unit '{}' is already registered", name);
                return false;
            }
            Set<MessageType> subscribed = subscriptions != null ? subscriptions : Set.of();
            inboxes.put(name, new Inbox(name, subscribed, laneCapacities));
            log.debug("Registered unit '{}' with subscriptions {}", name, subscribed);
            return true;
        } finally {
            registryLock.unlock();
        }
    }

    @Override
    public boolean unregister(String name) {
        Inbox inbox;
        registryLock.lock();
        try {
            inbox = inboxes.remove(name);
        } finally {
            registryLock.unlock();
        }
        if (inbox == null) {
            return false;
        }
        int lost = inbox.discard();
        log.debug("Unregistered unit '{}' ({} queued messages discarded)", name, lost);
        return true;
    }

    @Override
    public SendResult send(Message message) {
        if (message == null) {
            throw new NullPointerException("message");
        }
        String id = message.id();
        if (closed) {
            return reject(id, "Bus is closed");
        }
        if (message.sender().isEmpty()) {
            return reject(id, "Message has no sender");
        }

        List<Inbox> targets = resolveTargets(message);
        if (!message.isBroadcast()) {
            if (targets.isEmpty()) {
                return reject(id, "Recipient '" + message.recipient() + "' is not registered");
            }
            if (!targets.get(0).accepts(message)) {
                return reject(id, "Recipient '" + message.recipient() + "' does not subscribe to " + message.type());
            }
        } else if (targets.isEmpty() && message.requiresResponse()) {
            return reject(id, "No unit subscribes to " + message.type());
        }

        CompletableFuture<Object> slot = null;
        if (message.requiresResponse()) {
            slot = new CompletableFuture<>();
            if (pendingResponses.putIfAbsent(id, slot) != null) {
                return reject(id, "A response for message '" + id + "' is already pending");
            }
        }

        int deliveries = fanOut(message, targets);
        if (deliveries == 0 && !targets.isEmpty()) {
            if (slot != null) {
                pendingResponses.remove(id, slot);
            }
            return SendResult.dropped(id, "Lane " + message.priority() + " is full");
        }
        if (deliveries > 0) {
            sent.incrementAndGet();
        }
        if (slot == null) {
            return SendResult.delivered(id, deliveries);
        }
        return awaitResponse(message, slot, deliveries);
    }

    private List<Inbox> resolveTargets(Message message) {
        if (!message.isBroadcast()) {
            Inbox recipient = inboxes.get(message.recipient());
            return recipient != null ? List.of(recipient) : List.of();
        }
        List<Inbox> targets = new ArrayList<>();
        for (Inbox inbox : inboxes.values()) {
            if (inbox.accepts(message)) {
                targets.add(inbox);
            }
        }
        return targets;
    }

    private int fanOut(Message message, List<Inbox> targets) {
        int deliveries = 0;
        for (Inbox inbox : targets) {
            switch (inbox.offer(message)) {
                case ACCEPTED -> deliveries++;
                case ACCEPTED_AFTER_EVICTION -> {
                    deliveries++;
                    evicted.incrementAndGet();
                    log.debug("Evicted oldest {} message of '{}' to admit {}", message.priority(), inbox.getOwner(), message.id());
                }
                case REJECTED -> {
                    dropped.incrementAndGet();
                    log.debug("Dropped {} message {} for '{}': lane full", message.priority(), message.id(), inbox.getOwner());
                }
            }
        }
        return deliveries;
    }

    private SendResult awaitResponse(Message message, CompletableFuture<Object> slot, int deliveries) {
        String id = message.id();
        try {
            Object response = slot.get(message.responseTimeout().toNanos(), TimeUnit.NANOSECONDS);
            return SendResult.responded(id, deliveries, response);
        } catch (TimeoutException e) {
            timedOut.incrementAndGet();
            log.debug("No response for message {} within {}", id, message.responseTimeout());
            return SendResult.timedOut(id, deliveries);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SendResult.failed(id, deliveries, "Interrupted while waiting for response");
        } catch (ExecutionException | CancellationException e) {
            return SendResult.failed(id, deliveries, "Response cancelled: " + e.getMessage());
        } finally {
            pendingResponses.remove(id, slot);
        }
    }

    private SendResult reject(String id, String reason) {
        rejected.incrementAndGet();
        log.debug("Rejected message {}: {}", id, reason);
        return SendResult.rejected(id, reason);
    }

    @Override
    public List<Message> poll(String name, Duration timeout, int maxMessages) throws InterruptedException {
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages must be positive");
        }
        Inbox inbox = inboxes.get(name);
        if (inbox == null) {
            return Collections.emptyList();
        }
        inbox.touch();
        List<Message> batch = inbox.drain(Math.max(0, timeout.toNanos()), maxMessages);
        received.addAndGet(batch.size());
        return batch;
    }

    @Override
    public boolean respond(String messageId, Object payload) {
        CompletableFuture<Object> slot = pendingResponses.get(messageId);
        if (slot == null) {
            log.debug("Ignoring response for message {}: no sender is waiting", messageId);
            return false;
        }
        boolean completed = slot.complete(payload);
        if (completed) {
            responded.incrementAndGet();
        }
        return completed;
    }

    @Override
    public boolean heartbeat(String name) {
        Inbox inbox = inboxes.get(name);
        if (inbox == null) {
            return false;
        }
        inbox.touch();
        return true;
    }

    @Override
    public boolean isRegistered(String name) {
        return inboxes.containsKey(name);
    }

    @Override
    public Optional<UnitRegistration> getRegistration(String name) {
        return Optional.ofNullable(inboxes.get(name)).map(Inbox::snapshot);
    }

    @Override
    public List<UnitRegistration> getRegistrations() {
        List<UnitRegistration> registrations = new ArrayList<>();
        inboxes.values().forEach(inbox -> registrations.add(inbox.snapshot()));
        return registrations;
    }

    /**
     * Number of senders currently waiting for a response.
     *
     * @return The size of the pending-response table.
     */
    public int getPendingResponseCount() {
        return pendingResponses.size();
    }

    /**
     * Whether a sender is still waiting for the response to {@code messageId}.
     *
     * @param messageId The message id.
     * @return {@code true} if a response slot exists.
     */
    public boolean hasPendingResponse(String messageId) {
        return pendingResponses.containsKey(messageId);
    }

    @Override
    public BusStatistics getStatistics() {
        return new BusStatistics(
                sent.get(),
                received.get(),
                dropped.get(),
                evicted.get(),
                rejected.get(),
                responded.get(),
                timedOut.get(),
                inboxes.size(),
                pendingResponses.size());
    }

    @Override
    public void close() {
        registryLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            registryLock.unlock();
        }
        pendingResponses.values().forEach(slot -> slot.cancel(false));
        pendingResponses.clear();
        List<String> names = new ArrayList<>(inboxes.keySet());
        names.forEach(this::unregister);
        log.info("Message bus closed ({} units released)", names.size());
    }
}
