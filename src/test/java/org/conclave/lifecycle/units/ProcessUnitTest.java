package org.conclave.lifecycle.units;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.conclave.bus.InMemoryMessageBus;
import org.conclave.bus.api.Message;
import org.conclave.bus.api.MessageType;
import org.conclave.bus.api.SendResult;
import org.conclave.junit.extensions.logging.ExpectLog;
import org.conclave.junit.extensions.logging.LogLevel;
import org.conclave.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("integration")
@EnabledOnOs({OS.LINUX, OS.MAC})
@ExtendWith(LogWatchExtension.class)
class ProcessUnitTest {

    private static final String HEARTBEATS =
            "while true; do echo '{\"kind\":\"heartbeat\"}'; sleep 0.05; done";

    private static final String RESPONDER = String.join("\n",
            "while IFS= read -r line; do",
            "  case \"$line\" in",
            "    *'\"type\":\"SHUTDOWN\"'*) exit 0 ;;",
            "    *'\"type\":\"QUERY\"'*)",
            "      id=$(printf '%s' \"$line\" | sed -n 's/.*\"id\":\"\\([^\"]*\\)\".*/\\1/p')",
            "      printf '{\"kind\":\"response\",\"messageId\":\"%s\",\"payload\":\"pong\"}\\n' \"$id\" ;;",
            "  esac",
            "done");

    private InMemoryMessageBus bus;
    private ProcessUnit unit;

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessageBus();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (unit != null && unit.isAlive()) {
            unit.stop(Duration.ofSeconds(2));
        }
        bus.close();
    }

    private ProcessUnit unit(String name, String script, Map<String, Object> extra) {
        Config options = ConfigFactory.parseMap(extra)
                .withFallback(ConfigFactory.parseMap(Map.of("command", List.of("sh", "-c", script))));
        unit = new ProcessUnit(name, options, bus);
        return unit;
    }

    @Test
    void heartbeatsKeepTheUnitHealthy() throws Exception {
        ProcessUnit beating = unit("beating", HEARTBEATS, Map.of("heartbeat-timeout", "1s"));
        beating.start();
        Instant startedAt = beating.getLastHeartbeat();

        await().atMost(Duration.ofSeconds(3)).until(() -> beating.getLastHeartbeat().isAfter(startedAt));
        Thread.sleep(300);
        assertTrue(beating.healthCheck());

        beating.stop(Duration.ofSeconds(2));
        assertFalse(beating.isAlive());
        assertFalse(beating.healthCheck());
    }

    @Test
    void missingHeartbeatsMakeTheUnitUnhealthy() throws Exception {
        ProcessUnit silent = unit("silent", "exec sleep 5", Map.of("heartbeat-timeout", "100ms"));
        silent.start();

        assertTrue(silent.isAlive());
        await().atMost(Duration.ofSeconds(2)).until(() -> !silent.healthCheck());

        silent.stop(Duration.ofSeconds(2));
        assertFalse(silent.isAlive());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ProcessUnit", messagePattern = "Process of unit 'short' closed its output")
    void exitedProcessIsUnhealthy() throws Exception {
        ProcessUnit shortLived = unit("short", "exit 3", Map.of());
        shortLived.start();

        await().atMost(Duration.ofSeconds(2)).until(() -> !shortLived.isOutputOpen());
        assertFalse(shortLived.isAlive());
        assertFalse(shortLived.healthCheck());
    }

    @Test
    void queriesAreForwardedAndAnswered() throws Exception {
        assertTrue(bus.register("echo", Set.of(MessageType.QUERY)));
        ProcessUnit echo = unit("echo", RESPONDER, Map.of("poll-interval", "20ms"));
        echo.start();

        SendResult result = bus.send(Message.builder(MessageType.QUERY, "client")
                .recipient("echo")
                .payload("ping")
                .requiresResponse(Duration.ofSeconds(5))
                .build());

        assertEquals(SendResult.Outcome.RESPONDED, result.outcome());
        assertThat(result.responsePayload()).contains("pong");

        long start = System.nanoTime();
        echo.stop(Duration.ofSeconds(4));
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
        assertFalse(echo.isAlive());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ProcessUnit", messagePattern = "Ignoring malformed line from unit 'noisy'.*")
    void malformedOutputIsIgnored() throws Exception {
        ProcessUnit noisy = unit("noisy", "echo 'not json'; " + HEARTBEATS, Map.of("heartbeat-timeout", "1s"));
        noisy.start();
        Instant startedAt = noisy.getLastHeartbeat();

        await().atMost(Duration.ofSeconds(3)).until(() -> noisy.getLastHeartbeat().isAfter(startedAt));
        assertTrue(noisy.healthCheck());
        noisy.stop(Duration.ofSeconds(2));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ProcessUnit", messagePattern = "Skipping message raw for unit 'relay'.*")
    void unserializablePayloadIsSkippedAndLaterMessagesStillFlow() throws Exception {
        assertTrue(bus.register("relay", Set.of(MessageType.DATA_PACKET, MessageType.QUERY)));
        ProcessUnit relay = unit("relay", RESPONDER, Map.of("poll-interval", "20ms"));
        relay.start();

        bus.send(Message.builder(MessageType.DATA_PACKET, "client")
                .id("raw")
                .recipient("relay")
                .payload(new Object())
                .build());
        SendResult result = bus.send(Message.builder(MessageType.QUERY, "client")
                .recipient("relay")
                .payload("after")
                .requiresResponse(Duration.ofSeconds(5))
                .build());

        assertEquals(SendResult.Outcome.RESPONDED, result.outcome());
        assertTrue(relay.healthCheck());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ProcessUnit", messagePattern = "Could not forward messages to unit 'deaf'.*")
    void unitIsUnhealthyOnceItsInputCannotBeWritten() throws Exception {
        assertTrue(bus.register("deaf", Set.of(MessageType.DATA_PACKET)));
        ProcessUnit deaf = unit("deaf", "exec 0<&-; " + HEARTBEATS, Map.of("poll-interval", "20ms", "heartbeat-timeout", "1s"));
        deaf.start();

        bus.send(Message.builder(MessageType.DATA_PACKET, "client").recipient("deaf").payload("lost").build());

        await().atMost(Duration.ofSeconds(3)).until(() -> !deaf.healthCheck());
        assertTrue(deaf.isAlive());
    }

    @Test
    void startingARunningUnitAgainIsANoOp() throws Exception {
        ProcessUnit sleeper = unit("sleeper", "exec sleep 5", Map.of());
        sleeper.start();
        Instant startedAt = sleeper.getLastHeartbeat();

        assertDoesNotThrow(sleeper::start);
        assertTrue(sleeper.isAlive());
        assertEquals(startedAt, sleeper.getLastHeartbeat());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ProcessUnit", messagePattern = "Process of unit 'gone' closed its output")
    void stoppingAnExitedProcessClosesItsInput() throws Exception {
        ProcessUnit gone = unit("gone", "exit 0", Map.of());
        gone.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> !gone.isOutputOpen());
        assertTrue(gone.isInputOpen());

        gone.stop(Duration.ofSeconds(1));

        assertFalse(gone.isInputOpen());
    }

    @Test
    void emptyCommandIsRejected() {
        Config options = ConfigFactory.parseMap(Map.of("command", List.of()));

        assertThatThrownBy(() -> new ProcessUnit("broken", options, bus)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ProcessUnit("broken", ConfigFactory.empty(), bus)).isInstanceOf(IllegalArgumentException.class);
    }
}
