package org.conclave.bus.api;

import java.util.Optional;

/**
 * Outcome of {@link IMessageBus#send(Message)}. Recoverable conditions such as a full lane or an
 * expired response are reported here and never thrown.
 *
 * @param messageId  Id of the message the result belongs to.
 * @param outcome    What happened to the message.
 * @param deliveries Number of inboxes the message was placed in.
 * @param response   Response payload, only meaningful for {@link Outcome#RESPONDED}.
 * @param reason     Human readable explanation for failures, empty on success.
 */
public record SendResult(String messageId, Outcome outcome, int deliveries, Object response, String reason) {

    /**
     * The possible outcomes of a send.
     */
    public enum Outcome {
        /** Enqueued for at least one consumer, no response requested. */
        DELIVERED,
        /** Enqueued and answered before the response timeout. */
        RESPONDED,
        /** Refused synchronously: malformed, unknown recipient, duplicate id or closed bus. */
        REJECTED,
        /** Lost to backpressure on a full Normal or Low lane. */
        DROPPED,
        /** Enqueued but no response arrived in time. */
        TIMED_OUT,
        /** The pending response was cancelled, for example because the bus was closed. */
        FAILED
    }

    public static SendResult delivered(String messageId, int deliveries) {
        return new SendResult(messageId, Outcome.DELIVERED, deliveries, null, "");
    }

    public static SendResult responded(String messageId, int deliveries, Object response) {
        return new SendResult(messageId, Outcome.RESPONDED, deliveries, response, "");
    }

    public static SendResult rejected(String messageId, String reason) {
        return new SendResult(messageId, Outcome.REJECTED, 0, null, reason);
    }

    public static SendResult dropped(String messageId, String reason) {
        return new SendResult(messageId, Outcome.DROPPED, 0, null, reason);
    }

    public static SendResult timedOut(String messageId, int deliveries) {
        return new SendResult(messageId, Outcome.TIMED_OUT, deliveries, null, "No response within timeout");
    }

    public static SendResult failed(String messageId, int deliveries, String reason) {
        return new SendResult(messageId, Outcome.FAILED, deliveries, null, reason);
    }

    /**
     * @return {@code true} for {@link Outcome#DELIVERED} and {@link Outcome#RESPONDED}.
     */
    public boolean isSuccess() {
        return outcome == Outcome.DELIVERED || outcome == Outcome.RESPONDED;
    }

    /**
     * @return The response payload if the message was answered.
     */
    public Optional<Object> responsePayload() {
        return outcome == Outcome.RESPONDED ? Optional.ofNullable(response) : Optional.empty();
    }
}
