package org.conclave.bus.api;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * In-process message bus shared by all units of one node.
 * <p>
 * Units register under a unique name together with the message kinds they consume. Every
 * {@link #send(Message)} is fanned out once, at enqueue time, into the inbox of each matching
 * unit; {@link #poll(String, Duration)} only ever drains that unit's own inbox. Recoverable
 * conditions (full lane, missing response) are reported as {@link SendResult}s, never thrown.
 */
public interface IMessageBus extends AutoCloseable {

    /**
     * Registers a unit.
     *
     * @param name          Unique unit name.
     * @param subscriptions Message kinds the unit consumes.
     * @return {@code false} if the name is already registered; existing state is untouched.
     */
    boolean register(String name, Set<MessageType> subscriptions);

    /**
     * Removes a unit and discards its inbox. Directed messages still queued for it are lost and
     * their pending responses expire on their own timeout.
     *
     * @param name The unit to remove.
     * @return {@code false} if the unit was not registered.
     */
    boolean unregister(String name);

    /**
     * Sends a message. Blocks only if the message requires a response, and then at most for
     * its response timeout.
     *
     * @param message The message to send.
     * @return The outcome of the send.
     */
    SendResult send(Message message);

    /**
     * Drains the inbox of {@code name}, Critical lane first, waiting up to {@code timeout} for
     * the first message to arrive.
     *
     * @param name    The polling unit.
     * @param timeout Maximum time to wait when the inbox is empty.
     * @return The drained messages, empty on timeout or for an unknown unit.
     * @throws InterruptedException if interrupted while waiting.
     */
    default List<Message> poll(String name, Duration timeout) throws InterruptedException {
        return poll(name, timeout, Integer.MAX_VALUE);
    }

    /**
     * Like {@link #poll(String, Duration)} but returns at most {@code maxMessages} messages.
     *
     * @param name        The polling unit.
     * @param timeout     Maximum time to wait when the inbox is empty.
     * @param maxMessages Upper bound of the batch, must be positive.
     * @return The drained messages.
     * @throws InterruptedException if interrupted while waiting.
     */
    List<Message> poll(String name, Duration timeout, int maxMessages) throws InterruptedException;

    /**
     * Resolves the pending response of {@code messageId}.
     *
     * @param messageId Id of the message being answered.
     * @param payload   The response payload handed to the waiting sender.
     * @return {@code false} if no sender is waiting any more (already answered or expired).
     */
    boolean respond(String messageId, Object payload);

    /**
     * Refreshes the bus heartbeat of a unit.
     *
     * @param name The unit.
     * @return {@code false} if the unit is not registered.
     */
    boolean heartbeat(String name);

    boolean isRegistered(String name);

    Optional<UnitRegistration> getRegistration(String name);

    List<UnitRegistration> getRegistrations();

    BusStatistics getStatistics();

    /**
     * Closes the bus: pending responses fail, inboxes are discarded and further sends are
     * rejected. Idempotent.
     */
    @Override
    void close();
}
