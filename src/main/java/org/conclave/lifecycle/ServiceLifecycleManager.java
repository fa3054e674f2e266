package org.conclave.lifecycle;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.conclave.bus.api.IMessageBus;
import org.conclave.bus.api.MessageType;
import org.conclave.lifecycle.api.IPausableUnit;
import org.conclave.lifecycle.api.ISupervisedUnit;
import org.conclave.lifecycle.api.ManagerStatistics;
import org.conclave.lifecycle.api.ManagerStatus;
import org.conclave.lifecycle.api.RestartPolicy;
import org.conclave.lifecycle.api.ServiceState;
import org.conclave.lifecycle.api.ServiceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Starts, stops and supervises a set of {@link ISupervisedUnit}s that depend on each other.
 * <p>
 * Services are started in topological order of their declared dependencies and stopped in the
 * reverse order. Once {@link #startAll()} succeeded two periodic loops run on a private
 * scheduler:
 * <ul>
 *   <li>the health loop calls {@link ISupervisedUnit#healthCheck()} on every running service
 *       and restarts services that fail repeatedly, as decided by the {@link RestartPolicy};</li>
 *   <li>the dependency loop stops every running service one of whose dependencies is no
 *       longer running or paused.</li>
 * </ul>
 * Failures of units never propagate to the caller; they are logged and reflected in the
 * service state and counters.
 */
public class ServiceLifecycleManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceLifecycleManager.class);

    private final IMessageBus bus;
    private final Duration healthCheckInterval;
    private final Duration healthCheckTimeout;
    private final Duration dependencyCheckInterval;
    private final Duration staleAfter;
    private final Duration stopTimeout;
    private final Duration shutdownTimeout;
    private final RestartPolicy restartPolicy;

    private final Map<String, ServiceRecord> services = new LinkedHashMap<>();
    private final ReentrantLock registryLock = new ReentrantLock();
    private final ExecutorService unitCallExecutor;
    private final ReentrantLock supervisionLock = new ReentrantLock();
    private ScheduledExecutorService supervisor;
    private volatile boolean running = false;

    private final AtomicLong servicesStarted = new AtomicLong();
    private final AtomicLong servicesStopped = new AtomicLong();
    private final AtomicLong servicesFailed = new AtomicLong();
    private final AtomicLong totalRestarts = new AtomicLong();
    private volatile Duration startupTime;

    /**
     * Creates a manager with default timings.
     *
     * @param bus The bus services are registered on when they declare subscriptions.
     */
    public ServiceLifecycleManager(IMessageBus bus) {
        this(bus, ConfigFactory.empty());
    }

    /**
     * Creates a manager configured from the {@code manager} block of the configuration.
     *
     * @param bus     The bus services are registered on when they declare subscriptions.
     * @param options Timings and restart policy; missing keys use the defaults.
     * @throws IllegalArgumentException if a value is malformed or not positive.
     */
    public ServiceLifecycleManager(IMessageBus bus, Config options) {
        if (bus == null) {
            throw new IllegalArgumentException("Message bus must not be null");
        }
        this.bus = bus;

        Config defaults = ConfigFactory.parseMap(Map.of(
                "health-check-interval", "30s",
                "health-check-timeout", "10s",
                "dependency-check-interval", "60s",
                "stale-after", "5m",
                "stop-timeout", "10s",
                "shutdown-timeout", "30s"
        ));
        Config finalConfig = options.withFallback(defaults);
        try {
            this.healthCheckInterval = positive(finalConfig, "health-check-interval");
            this.healthCheckTimeout = positive(finalConfig, "health-check-timeout");
            this.dependencyCheckInterval = positive(finalConfig, "dependency-check-interval");
            this.staleAfter = positive(finalConfig, "stale-after");
            this.stopTimeout = positive(finalConfig, "stop-timeout");
            this.shutdownTimeout = positive(finalConfig, "shutdown-timeout");
            this.restartPolicy = finalConfig.hasPath("restart")
                    ? RestartPolicy.fromConfig(finalConfig.getConfig("restart"))
                    : RestartPolicy.defaults();
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for ServiceLifecycleManager", e);
        }

        this.unitCallExecutor = Executors.newCachedThreadPool(daemonThreads("unit-call"));
        log.debug("Lifecycle manager created (health every {}, dependencies every {}, {})",
                healthCheckInterval, dependencyCheckInterval, restartPolicy);
    }

    private static Duration positive(Config config, String path) {
        Duration value = config.getDuration(path);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(path + " must be positive");
        }
        return value;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // ---------------------------------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------------------------------

    /**
     * Registers a service.
     *
     * @param name          Unique service name.
     * @param unit          The unit to manage.
     * @param dependencies  Services that must be running before this one starts.
     * @param subscriptions Message kinds the unit consumes; the unit is registered on the bus
     *                      under {@code name} while it runs if this is not empty.
     * @return {@code false} if the name is already taken.
     * @throws IllegalArgumentException if the name is empty or the unit is missing.
     */
    public boolean register(String name, ISupervisedUnit unit, Set<String> dependencies, Set<MessageType> subscriptions) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Service name must not be empty");
        }
        if (unit == null) {
            throw new IllegalArgumentException("Service '" + name + "' has no unit to manage");
        }
        Set<String> declared = dependencies != null ? dependencies : Set.of();
        if (declared.contains(name)) {
            throw new IllegalArgumentException("Service '" + name + "' cannot depend on itself");
        }

        registryLock.lock();
        try {
            if (services.containsKey(name)) {
                log.warn("Service '{}' is already registered", name);
                return false;
            }
            ServiceRecord record = new ServiceRecord(name, unit, declared,
                    subscriptions != null ? subscriptions : Set.of());
            for (String dependency : declared) {
                ServiceRecord dependencyRecord = services.get(dependency);
                if (dependencyRecord != null) {
                    dependencyRecord.dependents().add(name);
                }
            }
            for (ServiceRecord existing : services.values()) {
                if (existing.dependencies().contains(name)) {
                    record.dependents().add(existing.name());
                }
            }
            services.put(name, record);
        } finally {
            registryLock.unlock();
        }
        log.info("Registered service '{}' (dependencies: {})", name, declared);
        return true;
    }

    /**
     * Removes a service that is not active.
     *
     * @param name The service name.
     * @return {@code false} if unknown or still running, paused or stopping.
     */
    public boolean unregister(String name) {
        registryLock.lock();
        try {
            ServiceRecord record = services.get(name);
            if (record == null) {
                return false;
            }
            ServiceState state = record.state();
            if (state == ServiceState.RUNNING || state == ServiceState.PAUSED || state == ServiceState.STOPPING) {
                log.warn("Cannot unregister service '{}' while it is {}", name, state);
                return false;
            }
            services.remove(name);
            for (String dependency : record.dependencies()) {
                ServiceRecord dependencyRecord = services.get(dependency);
                if (dependencyRecord != null) {
                    dependencyRecord.dependents().remove(name);
                }
            }
        } finally {
            registryLock.unlock();
        }
        bus.unregister(name);
        log.info("Unregistered service '{}'", name);
        return true;
    }

    // ---------------------------------------------------------------------------------------------
    // Single service lifecycle
    // ---------------------------------------------------------------------------------------------

    /**
     * Starts a service whose dependencies are all running.
     *
     * @param name The service name.
     * @return {@code true} if the service is running afterwards.
     */
    public boolean start(String name) {
        ServiceRecord record = find(name);
        if (record == null) {
            log.warn("Cannot start unknown service '{}'", name);
            return false;
        }

        record.lifecycleLock().lock();
        try {
            ServiceState state = record.state();
            if (state == ServiceState.RUNNING) {
                log.debug("Service '{}' is already running", name);
                return true;
            }
            if (state == ServiceState.PAUSED || state == ServiceState.STOPPING) {
                log.warn("Cannot start service '{}' while it is {}", name, state);
                return false;
            }
            for (String dependency : record.dependencies()) {
                ServiceRecord dependencyRecord = find(dependency);
                if (dependencyRecord == null) {
                    log.error("Cannot start service '{}': dependency '{}' is not registered", name, dependency);
                    return false;
                }
                if (dependencyRecord.state() != ServiceState.RUNNING) {
                    log.warn("Cannot start service '{}': dependency '{}' is {}", name, dependency, dependencyRecord.state());
                    return false;
                }
            }

            log.debug("Starting service '{}'...", name);
            record.markStarting();
            registerOnBus(record);
            try {
                record.unit().start();
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                record.markFailed("start failed: " + e.getMessage());
                servicesFailed.incrementAndGet();
                bus.unregister(name);
                log.error("Failed to start service '{}'", name, e);
                return false;
            }
            record.markRunning(Instant.now());
            servicesStarted.incrementAndGet();
            log.info("Service '{}' started", name);
            return true;
        } finally {
            record.lifecycleLock().unlock();
        }
    }

    /**
     * Stops a service after stopping its running dependents.
     *
     * @param name    The service name.
     * @param timeout Upper bound for the unit's own stop.
     * @return {@code true} if the service is stopped afterwards.
     */
    public boolean stop(String name, Duration timeout) {
        ServiceRecord record = find(name);
        if (record == null) {
            log.warn("Cannot stop unknown service '{}'", name);
            return false;
        }
        if (isStoppedOrIdle(record)) {
            return true;
        }
        if (record.state() == ServiceState.STOPPING) {
            return awaitStopInProgress(record, timeout);
        }

        for (String dependent : record.dependents()) {
            ServiceRecord dependentRecord = find(dependent);
            if (dependentRecord != null && dependentRecord.isActive()) {
                log.info("Stopping dependent '{}' of service '{}' first", dependent, name);
                stop(dependent, timeout);
            }
        }
        return stopUnit(record, timeout);
    }

    private boolean isStoppedOrIdle(ServiceRecord record) {
        return record.state() == ServiceState.STOPPED || !record.wasStartAttempted();
    }

    /**
     * Waits for a stop running on another thread and reports its outcome.
     */
    private boolean awaitStopInProgress(ServiceRecord record, Duration timeout) {
        log.debug("Service '{}' is already stopping, waiting for it", record.name());
        boolean locked;
        try {
            locked = record.lifecycleLock().tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (!locked) {
            log.warn("Timed out waiting for the lifecycle lock of service '{}'", record.name());
            return false;
        }
        try {
            return record.state() == ServiceState.STOPPED;
        } finally {
            record.lifecycleLock().unlock();
        }
    }

    /**
     * Stops the unit of a single record without touching its dependents.
     */
    private boolean stopUnit(ServiceRecord record, Duration timeout) {
        String name = record.name();
        boolean locked;
        try {
            locked = record.lifecycleLock().tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (!locked) {
            log.warn("Timed out waiting for the lifecycle lock of service '{}'", name);
            return false;
        }
        try {
            if (isStoppedOrIdle(record)) {
                return true;
            }
            log.debug("Stopping service '{}'...", name);
            record.setState(ServiceState.STOPPING);
            try {
                callBounded(() -> {
                    record.unit().stop(timeout);
                    return null;
                }, timeout);
                record.setState(ServiceState.STOPPED);
                servicesStopped.incrementAndGet();
                log.info("Service '{}' stopped", name);
                return true;
            } catch (TimeoutException e) {
                record.markFailed("stop timed out after " + timeout);
                log.error("Service '{}' did not stop within {}", name, timeout);
                return false;
            } catch (ExecutionException e) {
                record.markFailed("stop failed: " + e.getCause().getMessage());
                log.error("Failed to stop service '{}'", name, e.getCause());
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                record.markFailed("interrupted while stopping");
                return false;
            } finally {
                bus.unregister(name);
            }
        } finally {
            record.lifecycleLock().unlock();
        }
    }

    /**
     * Stops a service together with its running dependents, starts it again and then restarts
     * those dependents in start order.
     *
     * @param name The service name.
     * @return {@code true} if the service itself is running afterwards.
     */
    public boolean restart(String name) {
        ServiceRecord record = find(name);
        if (record == null) {
            log.warn("Cannot restart unknown service '{}'", name);
            return false;
        }
        List<String> dependentsToRestart = activeDependentsInStartOrder(name);

        log.info("Restarting service '{}'", name);
        if (!stop(name, stopTimeout)) {
            log.warn("Service '{}' did not stop cleanly before restart", name);
        }
        if (!restartPolicy.backoff().isZero()) {
            try {
                Thread.sleep(restartPolicy.backoff().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        boolean restarted = start(name);
        if (restarted) {
            for (String dependent : dependentsToRestart) {
                if (!start(dependent)) {
                    log.warn("Dependent '{}' could not be restarted after '{}'", dependent, name);
                }
            }
        }
        return restarted;
    }

    private List<String> activeDependentsInStartOrder(String name) {
        Set<String> affected = new LinkedHashSet<>();
        List<String> pending = new ArrayList<>(List.of(name));
        while (!pending.isEmpty()) {
            ServiceRecord current = find(pending.remove(0));
            if (current == null) {
                continue;
            }
            for (String dependent : current.dependents()) {
                ServiceRecord dependentRecord = find(dependent);
                if (dependentRecord != null && dependentRecord.isActive() && affected.add(dependent)) {
                    pending.add(dependent);
                }
            }
        }
        List<String> order = getStartOrder().orElseGet(this::registrationOrder);
        List<String> result = new ArrayList<>();
        for (String service : order) {
            if (affected.contains(service)) {
                result.add(service);
            }
        }
        return result;
    }

    /**
     * Pauses a running service whose unit supports it.
     *
     * @param name The service name.
     * @return {@code true} if the service is paused afterwards.
     */
    public boolean pause(String name) {
        return transition(name, ServiceState.RUNNING, ServiceState.PAUSED, IPausableUnit::pause);
    }

    /**
     * Resumes a paused service.
     *
     * @param name The service name.
     * @return {@code true} if the service is running afterwards.
     */
    public boolean resume(String name) {
        return transition(name, ServiceState.PAUSED, ServiceState.RUNNING, IPausableUnit::resume);
    }

    @FunctionalInterface
    private interface PauseAction {
        void apply(IPausableUnit unit) throws Exception;
    }

    private boolean transition(String name, ServiceState from, ServiceState to, PauseAction action) {
        ServiceRecord record = find(name);
        if (record == null) {
            log.warn("Unknown service '{}'", name);
            return false;
        }
        if (!(record.unit() instanceof IPausableUnit pausable)) {
            log.warn("Service '{}' does not support pause and resume", name);
            return false;
        }
        record.lifecycleLock().lock();
        try {
            if (record.state() == to) {
                return true;
            }
            if (record.state() != from) {
                log.warn("Cannot move service '{}' from {} to {}", name, record.state(), to);
                return false;
            }
            try {
                action.apply(pausable);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                record.setLastError(e.getMessage());
                log.error("Service '{}' failed to change to {}", name, to, e);
                return false;
            }
            record.setState(to);
            if (to == ServiceState.RUNNING) {
                record.recordHeartbeat(Instant.now());
            }
            log.info("Service '{}' is now {}", name, to);
            return true;
        } finally {
            record.lifecycleLock().unlock();
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Whole-graph lifecycle
    // ---------------------------------------------------------------------------------------------

    /**
     * Starts all services in dependency order and begins supervision.
     * <p>
     * If the dependency graph contains a cycle nothing is started. If a service fails to start,
     * the services started by this call are stopped again in reverse order.
     *
     * @return {@code true} if every service is running.
     */
    public boolean startAll() {
        Map<String, Set<String>> graph = dependencyGraph();
        Optional<List<String>> order = StartOrderResolver.resolve(graph);
        if (order.isEmpty()) {
            log.error("Circular dependency among services {}; no service was started",
                    StartOrderResolver.unresolvable(graph));
            return false;
        }

        log.info("Starting {} service(s) in order {}", order.get().size(), order.get());
        long startNanos = System.nanoTime();
        List<String> started = new ArrayList<>();
        for (String name : order.get()) {
            boolean wasRunning = isInState(name, ServiceState.RUNNING);
            if (!start(name)) {
                log.error("Startup aborted at service '{}'; stopping {} service(s) started so far", name, started.size());
                List<String> rollback = new ArrayList<>(started);
                Collections.reverse(rollback);
                for (String service : rollback) {
                    stop(service, stopTimeout);
                }
                return false;
            }
            if (!wasRunning) {
                started.add(name);
            }
        }

        startupTime = Duration.ofNanos(System.nanoTime() - startNanos);
        startSupervision();
        running = true;
        log.info("All services started in {} ms", startupTime.toMillis());
        return true;
    }

    /**
     * Ends supervision and stops all services in reverse start order.
     *
     * @return {@code true} if every service stopped cleanly.
     */
    public boolean stopAll() {
        stopSupervision();
        List<String> order = new ArrayList<>(getStartOrder().orElseGet(this::registrationOrder));
        Collections.reverse(order);

        boolean allStopped = true;
        for (String name : order) {
            if (!stop(name, shutdownTimeout)) {
                allStopped = false;
            }
        }
        running = false;
        if (allStopped) {
            log.info("All services stopped");
        } else {
            log.warn("Not all services stopped cleanly");
        }
        return allStopped;
    }

    /**
     * Stops all services and releases the manager's threads.
     */
    @Override
    public void close() {
        stopAll();
        unitCallExecutor.shutdownNow();
    }

    // ---------------------------------------------------------------------------------------------
    // Supervision
    // ---------------------------------------------------------------------------------------------

    private void startSupervision() {
        supervisionLock.lock();
        try {
            if (supervisor != null) {
                return;
            }
            supervisor = Executors.newScheduledThreadPool(2, daemonThreads("service-supervisor"));
            supervisor.scheduleAtFixedRate(this::healthLoop,
                    healthCheckInterval.toMillis(), healthCheckInterval.toMillis(), TimeUnit.MILLISECONDS);
            supervisor.scheduleAtFixedRate(this::dependencyLoop,
                    dependencyCheckInterval.toMillis(), dependencyCheckInterval.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            supervisionLock.unlock();
        }
    }

    private void stopSupervision() {
        ScheduledExecutorService current;
        supervisionLock.lock();
        try {
            current = supervisor;
            supervisor = null;
        } finally {
            supervisionLock.unlock();
        }
        if (current == null) {
            return;
        }
        current.shutdown();
        try {
            if (!current.awaitTermination(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void healthLoop() {
        try {
            runHealthChecks();
        } catch (RuntimeException e) {
            log.error("Health check cycle failed", e);
        }
    }

    private void dependencyLoop() {
        try {
            runDependencyChecks();
        } catch (RuntimeException e) {
            log.error("Dependency check cycle failed", e);
        }
    }

    /**
     * One pass of the health loop over all running services.
     */
    void runHealthChecks() {
        for (ServiceRecord record : snapshot()) {
            if (record.state() != ServiceState.RUNNING) {
                continue;
            }
            String failure = checkHealth(record);
            if (failure == null) {
                record.recordHeartbeat(Instant.now());
                continue;
            }
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            int errors = record.recordHealthFailure(failure);
            log.warn("Health check of service '{}' failed ({}/{}): {}",
                    record.name(), errors, restartPolicy.failureThreshold(), failure);
            if (errors >= restartPolicy.failureThreshold()) {
                handleRepeatedFailure(record);
            }
        }

        Instant threshold = Instant.now().minus(staleAfter);
        for (ServiceRecord record : snapshot()) {
            if (record.state() != ServiceState.RUNNING || record.lastHeartbeat() == null) {
                continue;
            }
            boolean stale = record.lastHeartbeat().isBefore(threshold);
            if (stale && !record.isStale()) {
                log.warn("Service '{}' appears stale: no heartbeat since {}", record.name(), record.lastHeartbeat());
            }
            record.setStale(stale);
        }
    }

    /**
     * @return {@code null} if healthy, otherwise the reason.
     */
    private String checkHealth(ServiceRecord record) {
        try {
            Boolean healthy = callBounded(record.unit()::healthCheck, healthCheckTimeout);
            return Boolean.TRUE.equals(healthy) ? null : "unit reported unhealthy";
        } catch (TimeoutException e) {
            return "no answer within " + healthCheckTimeout;
        } catch (ExecutionException e) {
            return "health check threw " + e.getCause();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "interrupted";
        }
    }

    private void handleRepeatedFailure(ServiceRecord record) {
        String name = record.name();
        if (!restartPolicy.allowsRestart(record.restartCount())) {
            log.error("Service '{}' exhausted its restart budget of {}; leaving it in ERROR", name, restartPolicy.maxRestarts());
            stopUnit(record, stopTimeout);
            record.markFailed("restart budget exhausted");
            return;
        }
        log.error("Service '{}' failed {} consecutive health checks; restarting", name, record.errorCount());
        record.countRestart();
        totalRestarts.incrementAndGet();
        if (!restart(name)) {
            log.error("Restart of service '{}' failed", name);
        }
    }

    /**
     * One pass of the dependency loop over all running services.
     */
    void runDependencyChecks() {
        for (ServiceRecord record : snapshot()) {
            if (record.state() != ServiceState.RUNNING) {
                continue;
            }
            for (String dependency : record.dependencies()) {
                ServiceRecord dependencyRecord = find(dependency);
                if (dependencyRecord == null) {
                    log.error("Service '{}' depends on '{}', which is not registered", record.name(), dependency);
                    continue;
                }
                if (!dependencyRecord.isActive()) {
                    log.warn("Dependency '{}' of service '{}' is {}; stopping '{}'",
                            dependency, record.name(), dependencyRecord.state(), record.name());
                    stop(record.name(), stopTimeout);
                    break;
                }
            }
        }
    }

    private <T> T callBounded(Callable<T> call, Duration timeout)
            throws TimeoutException, ExecutionException, InterruptedException {
        Future<T> future = unitCallExecutor.submit(call);
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private void registerOnBus(ServiceRecord record) {
        if (record.subscriptions().isEmpty() || bus.isRegistered(record.name())) {
            return;
        }
        if (!bus.register(record.name(), record.subscriptions())) {
            log.warn("Service '{}' could not be registered on the message bus", record.name());
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------------------------------

    /**
     * @param name The service name.
     * @return The status of the service, empty if unknown.
     */
    public Optional<ServiceStatus> getServiceStatus(String name) {
        return Optional.ofNullable(find(name)).map(ServiceRecord::snapshot);
    }

    /**
     * @return Status of the manager, all services and the bus.
     */
    public ManagerStatus getAllStatus() {
        Map<String, ServiceStatus> statuses = new LinkedHashMap<>();
        int runningServices = 0;
        int failedServices = 0;
        for (ServiceRecord record : snapshot()) {
            ServiceStatus status = record.snapshot();
            statuses.put(status.name(), status);
            if (status.state() == ServiceState.RUNNING) {
                runningServices++;
            } else if (status.state() == ServiceState.ERROR) {
                failedServices++;
            }
        }
        return new ManagerStatus(running, statuses.size(), runningServices, failedServices,
                getStatistics(), bus.getStatistics(), Collections.unmodifiableMap(statuses));
    }

    public ManagerStatistics getStatistics() {
        return new ManagerStatistics(
                servicesStarted.get(),
                servicesStopped.get(),
                servicesFailed.get(),
                totalRestarts.get(),
                startupTime);
    }

    /**
     * @return The order {@link #startAll()} would use, empty if the dependencies form a cycle.
     */
    public Optional<List<String>> getStartOrder() {
        return StartOrderResolver.resolve(dependencyGraph());
    }

    public boolean isRunning() {
        return running;
    }

    private boolean isInState(String name, ServiceState state) {
        ServiceRecord record = find(name);
        return record != null && record.state() == state;
    }

    private ServiceRecord find(String name) {
        registryLock.lock();
        try {
            return services.get(name);
        } finally {
            registryLock.unlock();
        }
    }

    private List<ServiceRecord> snapshot() {
        registryLock.lock();
        try {
            return new ArrayList<>(services.values());
        } finally {
            registryLock.unlock();
        }
    }

    private List<String> registrationOrder() {
        registryLock.lock();
        try {
            return new ArrayList<>(services.keySet());
        } finally {
            registryLock.unlock();
        }
    }

    private Map<String, Set<String>> dependencyGraph() {
        registryLock.lock();
        try {
            Map<String, Set<String>> graph = new LinkedHashMap<>();
            services.forEach((name, record) -> graph.put(name, record.dependencies()));
            return graph;
        } finally {
            registryLock.unlock();
        }
    }
}
