package org.conclave.bus.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable envelope that travels over the {@link IMessageBus}.
 * <p>
 * An empty recipient means broadcast: the message is delivered to every registered unit that
 * subscribes to its {@link MessageType}. A directed message is only delivered to its recipient.
 * Instances are created through {@link #builder(MessageType, String)}; the id is a random UUID
 * unless one is given explicitly.
 *
 * @param id               Unique id of the message.
 * @param type             Kind of the message.
 * @param priority         Lane the message is enqueued in.
 * @param sender           Name of the sending unit, never empty for a sendable message.
 * @param recipient        Name of the receiving unit, or the empty string for broadcast.
 * @param payload          Opaque payload, may be {@code null}.
 * @param createdAt        Creation timestamp.
 * @param requiresResponse Whether {@code send()} waits for a matching {@code respond()}.
 * @param responseTimeout  How long {@code send()} waits for the response.
 * @param correlationId    Groups messages of one logical session, may be empty.
 */
public record Message(
    String id,
    MessageType type,
    Priority priority,
    String sender,
    String recipient,
    Object payload,
    Instant createdAt,
    boolean requiresResponse,
    Duration responseTimeout,
    String correlationId
) {

    /** Response timeout used when the builder is not given one. */
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(5);

    public Message {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(responseTimeout, "responseTimeout");
        sender = sender == null ? "" : sender;
        recipient = recipient == null ? "" : recipient;
        correlationId = correlationId == null ? "" : correlationId;
        if (requiresResponse && (responseTimeout.isNegative() || responseTimeout.isZero())) {
            throw new IllegalArgumentException("Message '" + id + "' requires a response but has no positive response timeout");
        }
    }

    /**
     * Whether this message is addressed to all subscribers of its type.
     *
     * @return {@code true} if the recipient is empty.
     */
    public boolean isBroadcast() {
        return recipient.isEmpty();
    }

    /**
     * Creates a builder for a message of the given type sent by {@code sender}.
     *
     * @param type   The message kind.
     * @param sender The sending unit.
     * @return A new builder with priority {@link Priority#NORMAL} and no recipient.
     */
    public static Builder builder(MessageType type, String sender) {
        return new Builder(type, sender);
    }

    /**
     * Fluent builder for {@link Message}.
     */
    public static final class Builder {
        private final MessageType type;
        private final String sender;
        private String id;
        private Priority priority = Priority.NORMAL;
        private String recipient = "";
        private Object payload;
        private boolean requiresResponse;
        private Duration responseTimeout = DEFAULT_RESPONSE_TIMEOUT;
        private String correlationId = "";

        private Builder(MessageType type, String sender) {
            this.type = type;
            this.sender = sender;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder recipient(String recipient) {
            this.recipient = recipient;
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        public Builder requiresResponse(Duration timeout) {
            this.requiresResponse = true;
            this.responseTimeout = timeout;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Message build() {
            return new Message(
                id != null ? id : UUID.randomUUID().toString(),
                type,
                priority,
                sender,
                recipient,
                payload,
                Instant.now(),
                requiresResponse,
                responseTimeout,
                correlationId);
        }
    }
}
