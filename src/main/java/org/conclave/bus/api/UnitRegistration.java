package org.conclave.bus.api;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of a unit registered on the bus.
 *
 * @param name          Registered name.
 * @param subscriptions Message kinds the unit consumes.
 * @param registeredAt  Registration time.
 * @param lastHeartbeat Last registration, poll or explicit heartbeat.
 * @param backlog       Queued messages per priority lane of the unit's inbox.
 */
public record UnitRegistration(
    String name,
    Set<MessageType> subscriptions,
    Instant registeredAt,
    Instant lastHeartbeat,
    Map<Priority, Integer> backlog
) {
}
