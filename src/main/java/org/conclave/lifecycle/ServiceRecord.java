package org.conclave.lifecycle;

import org.conclave.bus.api.MessageType;
import org.conclave.lifecycle.api.ISupervisedUnit;
import org.conclave.lifecycle.api.ServiceState;
import org.conclave.lifecycle.api.ServiceStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bookkeeping for one managed unit. Only {@link ServiceLifecycleManager} mutates a record;
 * start and stop of the same service are serialised through {@link #lifecycleLock()}.
 */
final class ServiceRecord {

    private final String name;
    private final ISupervisedUnit unit;
    private final Set<String> dependencies;
    private final Set<String> dependents = new CopyOnWriteArraySet<>();
    private final Set<MessageType> subscriptions;
    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private final AtomicReference<ServiceState> state = new AtomicReference<>(ServiceState.INITIALIZING);
    private final AtomicInteger errorCount = new AtomicInteger();
    private final AtomicInteger restartCount = new AtomicInteger();
    private volatile Instant startedAt;
    private volatile Instant lastHeartbeat;
    private volatile boolean startAttempted;
    private volatile boolean stale;
    private volatile String lastError = "";

    ServiceRecord(String name, ISupervisedUnit unit, Set<String> dependencies, Set<MessageType> subscriptions) {
        this.name = name;
        this.unit = unit;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        this.subscriptions = subscriptions.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(MessageType.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(subscriptions));
    }

    String name() {
        return name;
    }

    ISupervisedUnit unit() {
        return unit;
    }

    Set<String> dependencies() {
        return dependencies;
    }

    Set<String> dependents() {
        return dependents;
    }

    Set<MessageType> subscriptions() {
        return subscriptions;
    }

    ReentrantLock lifecycleLock() {
        return lifecycleLock;
    }

    ServiceState state() {
        return state.get();
    }

    void setState(ServiceState newState) {
        state.set(newState);
    }

    boolean isActive() {
        ServiceState current = state.get();
        return current == ServiceState.RUNNING || current == ServiceState.PAUSED;
    }

    boolean wasStartAttempted() {
        return startAttempted;
    }

    void markStarting() {
        startAttempted = true;
        state.set(ServiceState.INITIALIZING);
    }

    void markRunning(Instant now) {
        startedAt = now;
        lastHeartbeat = now;
        errorCount.set(0);
        stale = false;
        lastError = "";
        state.set(ServiceState.RUNNING);
    }

    /**
     * Moves the record to ERROR and counts the failure.
     *
     * @return The consecutive error count after the failure.
     */
    int markFailed(String reason) {
        lastError = reason;
        state.set(ServiceState.ERROR);
        return errorCount.incrementAndGet();
    }

    /**
     * Counts a failed health check without changing the state.
     *
     * @return The consecutive error count after the failure.
     */
    int recordHealthFailure(String reason) {
        lastError = reason;
        return errorCount.incrementAndGet();
    }

    void recordHeartbeat(Instant now) {
        lastHeartbeat = now;
        errorCount.set(0);
        stale = false;
    }

    Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    int errorCount() {
        return errorCount.get();
    }

    int restartCount() {
        return restartCount.get();
    }

    void countRestart() {
        restartCount.incrementAndGet();
    }

    boolean isStale() {
        return stale;
    }

    void setStale(boolean stale) {
        this.stale = stale;
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    ServiceStatus snapshot() {
        return new ServiceStatus(
                name,
                state.get(),
                startedAt,
                lastHeartbeat,
                errorCount.get(),
                restartCount.get(),
                stale,
                lastError,
                dependencies,
                Collections.unmodifiableSet(new LinkedHashSet<>(dependents)),
                subscriptions);
    }
}
