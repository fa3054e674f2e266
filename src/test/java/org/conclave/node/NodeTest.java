package org.conclave.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.conclave.bus.api.IMessageBus;
import org.conclave.bus.api.Message;
import org.conclave.bus.api.MessageType;
import org.conclave.bus.api.Priority;
import org.conclave.bus.api.SendResult;
import org.conclave.junit.extensions.logging.ExpectLog;
import org.conclave.junit.extensions.logging.LogLevel;
import org.conclave.junit.extensions.logging.LogWatchExtension;
import org.conclave.lifecycle.api.ISupervisedUnit;
import org.conclave.lifecycle.api.ServiceState;
import org.conclave.lifecycle.api.ServiceStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for Node: configuration parsing, reflective unit creation and lifecycle.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class NodeTest {

    private Node testNode;

    @AfterEach
    void tearDown() {
        if (testNode != null) {
            testNode.stop();
            testNode = null;
        }
    }

    private static Config config(String services) {
        return ConfigFactory.parseString("""
            conclave {
              manager { health-check-interval = 1h, dependency-check-interval = 1h }
              services {
            """ + services + """
              }
            }
            """);
    }

    @Test
    @DisplayName("Should create units through the richest available constructor")
    void constructor_shouldInstantiateUnitsReflectively() {
        testNode = new Node(config("""
                store { className = "org.conclave.node.NodeTest$BusAwareUnit", options { label = "primary" } }
                cache { className = "org.conclave.node.NodeTest$ConfigOnlyUnit", dependencies = ["store"] }
                probe { className = "org.conclave.node.NodeTest$PlainUnit", subscriptions = ["heartbeat", "QUERY"] }
                """));

        assertThat(testNode.getSkippedServices()).isEmpty();
        assertEquals(3, testNode.getManager().getAllStatus().totalServices());
        assertThat(testNode.getManager().getStartOrder()).contains(List.of("probe", "store", "cache"));

        ServiceStatus probe = testNode.getManager().getServiceStatus("probe").orElseThrow();
        assertThat(probe.subscriptions()).containsExactlyInAnyOrder(MessageType.HEARTBEAT, MessageType.QUERY);
        assertThat(testNode.getManager().getServiceStatus("cache").orElseThrow().dependencies()).containsExactly("store");

        assertEquals("store", BusAwareUnit.lastCreated.name);
        assertEquals("primary", BusAwareUnit.lastCreated.options.getString("label"));
        assertSame(testNode.getBus(), BusAwareUnit.lastCreated.bus);
    }

    @Test
    @DisplayName("Should skip definitions that cannot be turned into a unit")
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*Node", messagePattern = "Class '.*NotAUnit' of service 'stranger' does not implement ISupervisedUnit.*")
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*Node", messagePattern = "Failed to initialize service '(exploding|missing|typo)'.*", occurrences = 3)
    void constructor_shouldSkipBrokenDefinitions() {
        testNode = new Node(config("""
                good { className = "org.conclave.node.NodeTest$PlainUnit" }
                stranger { className = "org.conclave.node.NodeTest$NotAUnit" }
                exploding { className = "org.conclave.node.NodeTest$ExplodingUnit" }
                missing { className = "org.conclave.node.DoesNotExist" }
                typo { className = "org.conclave.node.NodeTest$PlainUnit", subscriptions = ["DATA_PACKETS"] }
                """));

        assertThat(testNode.getSkippedServices()).containsExactlyInAnyOrder("stranger", "exploding", "missing", "typo");
        assertThat(testNode.getManager().getAllStatus().services().keySet()).containsExactly("good");
    }

    @Test
    @DisplayName("Should start all services and stop them again")
    void start_shouldRunAllServicesUntilStopped() {
        testNode = new Node(config("""
                a { className = "org.conclave.node.NodeTest$PlainUnit" }
                b { className = "org.conclave.node.NodeTest$PlainUnit", dependencies = ["a"] }
                """));

        assertTrue(testNode.start());
        assertEquals(ServiceState.RUNNING, testNode.getManager().getServiceStatus("b").orElseThrow().state());

        testNode.stop();
        assertEquals(ServiceState.STOPPED, testNode.getManager().getServiceStatus("a").orElseThrow().state());
        assertEquals(ServiceState.STOPPED, testNode.getManager().getServiceStatus("b").orElseThrow().state());
        testNode = null;
    }

    @Test
    @DisplayName("Should pass the bus block to the message bus")
    void constructor_shouldConfigureBusLanes() {
        testNode = new Node(ConfigFactory.parseString("""
            conclave {
              bus.lanes.normal = 1
              services {}
            }
            """));
        IMessageBus bus = testNode.getBus();
        bus.register("sink", Set.of(MessageType.DATA_PACKET));

        Message first = Message.builder(MessageType.DATA_PACKET, "test").recipient("sink").priority(Priority.NORMAL).build();
        Message second = Message.builder(MessageType.DATA_PACKET, "test").recipient("sink").priority(Priority.NORMAL).build();

        assertEquals(SendResult.Outcome.DELIVERED, bus.send(first).outcome());
        assertEquals(SendResult.Outcome.DROPPED, bus.send(second).outcome());
    }

    @Test
    @DisplayName("Should warn when no services are configured")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*Node", messagePattern = "Configuration path 'conclave.services' not found.*")
    void constructor_shouldWarnWithoutServices() {
        testNode = new Node(ConfigFactory.empty());

        assertEquals(0, testNode.getManager().getAllStatus().totalServices());
        assertTrue(testNode.start());
    }

    public static class PlainUnit implements ISupervisedUnit {
        @Override
        public void start() {
        }

        @Override
        public void stop(Duration timeout) {
        }

        @Override
        public boolean healthCheck() {
            return true;
        }
    }

    public static class ConfigOnlyUnit extends PlainUnit {
        public ConfigOnlyUnit(Config options) {
        }
    }

    public static class BusAwareUnit extends PlainUnit {
        static volatile BusAwareUnit lastCreated;
        final String name;
        final Config options;
        final IMessageBus bus;

        public BusAwareUnit(String name, Config options, IMessageBus bus) {
            this.name = name;
            this.options = options;
            this.bus = bus;
            lastCreated = this;
        }
    }

    public static class ExplodingUnit extends PlainUnit {
        public ExplodingUnit() {
            throw new IllegalStateException("no resources");
        }
    }

    public static class NotAUnit {
    }
}
