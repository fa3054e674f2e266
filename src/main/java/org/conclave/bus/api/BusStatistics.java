package org.conclave.bus.api;

/**
 * Point-in-time snapshot of the counters of one bus instance.
 *
 * @param sent             Messages accepted by {@code send()} and placed in at least one inbox.
 * @param received         Messages handed out by {@code poll()}.
 * @param dropped          Messages refused by a full Normal or Low lane, per target inbox.
 * @param evicted          Oldest entries discarded by a full Critical or High lane.
 * @param rejected         Sends refused synchronously.
 * @param responded        Pending responses resolved through {@code respond()}.
 * @param timedOut         Pending responses that expired.
 * @param activeUnits      Currently registered units.
 * @param pendingResponses Response slots currently awaiting resolution.
 */
public record BusStatistics(
    long sent,
    long received,
    long dropped,
    long evicted,
    long rejected,
    long responded,
    long timedOut,
    int activeUnits,
    int pendingResponses
) {
}
