package org.conclave.lifecycle.api;

import org.conclave.bus.api.MessageType;

import java.time.Instant;
import java.util.Set;

/**
 * Snapshot of one managed service.
 *
 * @param name          Service name.
 * @param state         Current lifecycle state.
 * @param startedAt     Time of the last successful start, {@code null} if never started.
 * @param lastHeartbeat Time of the last successful start or health check, {@code null} if none.
 * @param errorCount    Consecutive failures since the last successful start or health check.
 * @param restartCount  Restarts triggered by the health loop.
 * @param stale         Whether the heartbeat is older than the staleness window.
 * @param lastError     Description of the most recent failure, empty if none.
 * @param dependencies  Services this service requires.
 * @param dependents    Services that require this service.
 * @param subscriptions Message kinds the service consumes on the bus.
 */
public record ServiceStatus(
    String name,
    ServiceState state,
    Instant startedAt,
    Instant lastHeartbeat,
    int errorCount,
    int restartCount,
    boolean stale,
    String lastError,
    Set<String> dependencies,
    Set<String> dependents,
    Set<MessageType> subscriptions
) {
}
