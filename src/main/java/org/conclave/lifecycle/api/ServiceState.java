package org.conclave.lifecycle.api;

/**
 * Lifecycle state of a managed service.
 * <pre>
 * INITIALIZING -> RUNNING -> STOPPING -> STOPPED
 *                 RUNNING <-> PAUSED
 * INITIALIZING | RUNNING | STOPPING -> ERROR
 * </pre>
 * STOPPED and ERROR are left only through an explicit start.
 */
public enum ServiceState {
    /**
     * Registered but not yet started, or currently starting.
     */
    INITIALIZING,
    /**
     * Started and supervised by the health loop.
     */
    RUNNING,
    /**
     * Temporarily suspended; not health checked.
     */
    PAUSED,
    /**
     * Stop in progress.
     */
    STOPPING,
    /**
     * Stopped cleanly.
     */
    STOPPED,
    /**
     * A lifecycle call failed or timed out, or the restart budget is exhausted.
     */
    ERROR
}
