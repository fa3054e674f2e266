package org.conclave.lifecycle.api;

import java.time.Duration;

/**
 * The capability contract every component managed by the service lifecycle manager must
 * expose. The manager is otherwise agnostic to what the unit does.
 */
public interface ISupervisedUnit {

    /**
     * Starts the unit. Must be idempotent if the unit is already running and may block for as
     * long as the unit needs to become operational.
     *
     * @throws Exception if the unit cannot be started; the service moves to ERROR.
     */
    void start() throws Exception;

    /**
     * Stops the unit. Implementations must return within {@code timeout}; the manager treats a
     * call that outlives it as failed and interrupts it.
     *
     * @param timeout The time the unit is given to shut down.
     * @throws Exception if the unit cannot be stopped cleanly.
     */
    void stop(Duration timeout) throws Exception;

    /**
     * Reports whether the unit is healthy. Called periodically while the service is RUNNING.
     *
     * @return {@code true} if healthy.
     * @throws Exception if the check itself fails; counted as an unhealthy result.
     */
    boolean healthCheck() throws Exception;
}
