package org.conclave.lifecycle.api;

import org.conclave.bus.api.BusStatistics;

import java.util.Map;

/**
 * Aggregated snapshot of a manager, its services and the bus it uses.
 *
 * @param running         Whether {@code startAll()} succeeded and supervision is active.
 * @param totalServices   Registered services.
 * @param runningServices Services in RUNNING state.
 * @param failedServices  Services in ERROR state.
 * @param statistics      Manager counters.
 * @param bus             Bus counters.
 * @param services        Per-service status in registration order.
 */
public record ManagerStatus(
    boolean running,
    int totalServices,
    int runningServices,
    int failedServices,
    ManagerStatistics statistics,
    BusStatistics bus,
    Map<String, ServiceStatus> services
) {
}
