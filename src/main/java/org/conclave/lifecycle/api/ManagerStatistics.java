package org.conclave.lifecycle.api;

import java.time.Duration;

/**
 * Counters of one service lifecycle manager instance.
 *
 * @param servicesStarted Successful starts.
 * @param servicesStopped Successful stops.
 * @param servicesFailed  Failed starts.
 * @param totalRestarts   Restart cycles triggered by the health loop.
 * @param startupTime     Duration of the last successful {@code startAll()}, {@code null} if none.
 */
public record ManagerStatistics(
    long servicesStarted,
    long servicesStopped,
    long servicesFailed,
    long totalRestarts,
    Duration startupTime
) {
}
