package org.conclave.bus.api;

/**
 * The closed set of message kinds that travel over the bus. Units subscribe to kinds,
 * not to senders.
 */
public enum MessageType {
    /** Opaque work item for the receiving unit. */
    DATA_PACKET,
    /** Operator or manager instruction such as pause or status. */
    SYSTEM_COMMAND,
    /** Liveness probe; usually sent with a response requested. */
    HEALTH_CHECK,
    /** Unsolicited liveness signal from a unit. */
    HEARTBEAT,
    /** Notification that a unit changed its internal state. */
    STATE_UPDATE,
    /** Request for information from another unit. */
    QUERY,
    /** Reply payload travelling as a regular message. */
    RESPONSE,
    /** Request to terminate. */
    SHUTDOWN
}
