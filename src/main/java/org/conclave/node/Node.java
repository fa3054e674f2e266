package org.conclave.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.conclave.bus.InMemoryMessageBus;
import org.conclave.bus.api.IMessageBus;
import org.conclave.bus.api.MessageType;
import org.conclave.lifecycle.ServiceLifecycleManager;
import org.conclave.lifecycle.api.ISupervisedUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * A Conclave node: one message bus, one lifecycle manager and the services configured under
 * {@code conclave.services}.
 *
 * <pre>
 * conclave.services {
 *   store {
 *     className = "com.example.StoreUnit"
 *   }
 *   worker {
 *     className = "org.conclave.lifecycle.units.ProcessUnit"
 *     dependencies = ["store"]
 *     subscriptions = ["DATA_PACKET", "QUERY"]
 *     options { command = ["python3", "worker.py"] }
 *   }
 * }
 * </pre>
 * Units are created reflectively. The first public constructor found among
 * {@code (String name, Config options, IMessageBus bus)}, {@code (String name, Config options)},
 * {@code (Config options)} and {@code ()} is used. A definition that cannot be instantiated is
 * logged and skipped; the remaining services are still registered.
 */
public final class Node {

    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    private static final String ROOT_CONFIG_PATH = "conclave";
    private static final String SERVICES_CONFIG_PATH = "services";

    private final IMessageBus bus;
    private final ServiceLifecycleManager manager;
    private final List<String> skippedServices = new ArrayList<>();
    private Thread shutdownHook;

    /**
     * Builds the node from the fully resolved application configuration.
     *
     * @param config The application configuration.
     * @throws IllegalArgumentException if the bus or manager settings are invalid.
     */
    public Node(final Config config) {
        final Config root = config.hasPath(ROOT_CONFIG_PATH) ? config.getConfig(ROOT_CONFIG_PATH) : ConfigFactory.empty();
        this.bus = new InMemoryMessageBus(block(root, "bus"));
        this.manager = new ServiceLifecycleManager(bus, block(root, "manager"));
        initializeServices(root);
    }

    private static Config block(final Config config, final String path) {
        return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
    }

    /**
     * Starts all services and registers a shutdown hook that stops them again.
     *
     * @return {@code true} if every service is running.
     */
    public boolean start() {
        if (!manager.startAll()) {
            LOGGER.error("Node failed to start its services.");
            return false;
        }
        shutdownHook = new Thread(this::stop, "conclave-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started successfully. Running until interrupted.");
        return true;
    }

    /**
     * Stops all services and closes the bus.
     */
    public void stop() {
        LOGGER.info("Shutdown sequence initiated...");
        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
            }
        }
        manager.close();
        bus.close();
        LOGGER.info("All services stopped. Goodbye.");
    }

    public ServiceLifecycleManager getManager() {
        return manager;
    }

    public IMessageBus getBus() {
        return bus;
    }

    /**
     * @return Names of configured services that could not be created.
     */
    public List<String> getSkippedServices() {
        return List.copyOf(skippedServices);
    }

    private void initializeServices(final Config root) {
        if (!root.hasPath(SERVICES_CONFIG_PATH)) {
            LOGGER.warn("Configuration path '{}.{}' not found. No services will be managed.", ROOT_CONFIG_PATH, SERVICES_CONFIG_PATH);
            return;
        }
        final Config servicesConfig = root.getConfig(SERVICES_CONFIG_PATH);
        final Set<String> names = new TreeSet<>(servicesConfig.root().keySet());
        LOGGER.debug("Found {} configured service(s): {}", names.size(), names);

        for (final String name : names) {
            try {
                final Config definition = servicesConfig.getConfig(name);
                final String className = definition.getString("className");
                final Set<String> dependencies = definition.hasPath("dependencies")
                        ? new LinkedHashSet<>(definition.getStringList("dependencies"))
                        : Set.of();
                final Set<MessageType> subscriptions = parseSubscriptions(definition);
                final Config options = block(definition, "options");

                final Class<?> clazz = Class.forName(className);
                if (!ISupervisedUnit.class.isAssignableFrom(clazz)) {
                    LOGGER.error("Class '{}' of service '{}' does not implement {}. Skipping this service.",
                            className, name, ISupervisedUnit.class.getSimpleName());
                    skippedServices.add(name);
                    continue;
                }
                final ISupervisedUnit unit = instantiate(clazz.asSubclass(ISupervisedUnit.class), name, options);
                if (!manager.register(name, unit, dependencies, subscriptions)) {
                    skippedServices.add(name);
                }
            } catch (final Exception e) {
                LOGGER.error("Failed to initialize service '{}'. Skipping this service.", name, e);
                skippedServices.add(name);
            }
        }
        LOGGER.info("Initialized {} of {} configured service(s).", names.size() - skippedServices.size(), names.size());
    }

    private static Set<MessageType> parseSubscriptions(final Config definition) {
        final Set<MessageType> subscriptions = EnumSet.noneOf(MessageType.class);
        if (definition.hasPath("subscriptions")) {
            for (final String type : definition.getStringList("subscriptions")) {
                subscriptions.add(MessageType.valueOf(type.trim().toUpperCase(Locale.ROOT)));
            }
        }
        return subscriptions;
    }

    private ISupervisedUnit instantiate(final Class<? extends ISupervisedUnit> clazz, final String name, final Config options)
            throws ReflectiveOperationException {
        try {
            try {
                final Constructor<? extends ISupervisedUnit> constructor = clazz.getConstructor(String.class, Config.class, IMessageBus.class);
                return constructor.newInstance(name, options, bus);
            } catch (final NoSuchMethodException ignored) {
                LOGGER.debug("No (String, Config, IMessageBus) constructor on {}", clazz.getName());
            }
            try {
                return clazz.getConstructor(String.class, Config.class).newInstance(name, options);
            } catch (final NoSuchMethodException ignored) {
                LOGGER.debug("No (String, Config) constructor on {}", clazz.getName());
            }
            try {
                return clazz.getConstructor(Config.class).newInstance(options);
            } catch (final NoSuchMethodException ignored) {
                LOGGER.debug("No (Config) constructor on {}", clazz.getName());
            }
            return clazz.getConstructor().newInstance();
        } catch (final InvocationTargetException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}
