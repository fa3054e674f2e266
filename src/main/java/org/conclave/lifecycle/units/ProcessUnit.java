package org.conclave.lifecycle.units;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.conclave.bus.api.IMessageBus;
import org.conclave.bus.api.Message;
import org.conclave.lifecycle.api.ISupervisedUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Supervised unit backed by an operating system process.
 * <p>
 * The child talks JSON lines over its standard streams. Messages the bus delivers to this unit
 * are written to the child's stdin, one JSON object per line. The child writes to stdout:
 * <pre>
 * {"kind":"heartbeat"}
 * {"kind":"response","messageId":"&lt;id&gt;","payload":&lt;any JSON&gt;}
 * </pre>
 * A heartbeat refreshes the liveness timestamp; a response completes the pending
 * {@code send()} of the message with that id. A message whose payload cannot be written as JSON
 * is logged and skipped. The unit is healthy while the process and its forwarding thread are
 * alive and the last heartbeat is younger than {@code heartbeat-timeout}.
 * <p>
 * Options:
 * <pre>
 * command = ["python3", "worker.py"]
 * working-directory = "/opt/worker"   # optional
 * heartbeat-timeout = 30s
 * poll-interval = 100ms
 * </pre>
 */
public class ProcessUnit implements ISupervisedUnit {

    private static final Logger log = LoggerFactory.getLogger(ProcessUnit.class);
    private static final int FORWARD_BATCH_SIZE = 32;

    private final String name;
    private final IMessageBus bus;
    private final List<String> command;
    private final File workingDirectory;
    private final Duration heartbeatTimeout;
    private final Duration pollInterval;
    private final ObjectMapper mapper;

    private final Object writeLock = new Object();
    private volatile Process process;
    private volatile BufferedWriter stdin;
    private volatile Thread drainThread;
    private volatile Thread forwardThread;
    private volatile Instant lastHeartbeat;
    private volatile boolean stopping = false;

    /**
     * Creates the unit from its options block.
     *
     * @param name    The service name, also used as the unit's name on the bus.
     * @param options The unit options.
     * @param bus     The bus to forward messages from and resolve responses on.
     * @throws IllegalArgumentException if {@code command} is missing or empty.
     */
    public ProcessUnit(String name, Config options, IMessageBus bus) {
        this.name = name;
        this.bus = bus;
        Config defaults = ConfigFactory.parseMap(Map.of(
                "heartbeat-timeout", "30s",
                "poll-interval", "100ms"
        ));
        Config finalConfig = options.withFallback(defaults);
        try {
            this.command = List.copyOf(finalConfig.getStringList("command"));
            this.workingDirectory = finalConfig.hasPath("working-directory")
                    ? new File(finalConfig.getString("working-directory"))
                    : null;
            this.heartbeatTimeout = finalConfig.getDuration("heartbeat-timeout");
            this.pollInterval = finalConfig.getDuration("poll-interval");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for process unit '" + name + "'", e);
        }
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Process unit '" + name + "' has an empty command");
        }
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void start() throws IOException {
        if (process != null && process.isAlive()) {
            log.debug("Process of unit '{}' is already running (pid {})", name, process.pid());
            return;
        }
        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT);
        if (workingDirectory != null) {
            builder.directory(workingDirectory);
        }

        stopping = false;
        Process started = builder.start();
        process = started;
        lastHeartbeat = Instant.now();
        stdin = new BufferedWriter(new OutputStreamWriter(started.getOutputStream(), StandardCharsets.UTF_8));

        drainThread = new Thread(() -> drainStdout(started), "process-" + name + "-stdout");
        drainThread.setDaemon(true);
        drainThread.start();

        forwardThread = new Thread(this::forwardInbox, "process-" + name + "-inbox");
        forwardThread.setDaemon(true);
        forwardThread.start();

        log.info("Started process for unit '{}' (pid {}): {}", name, started.pid(), command);
    }

    @Override
    public void stop(Duration timeout) throws IOException, InterruptedException {
        Process current = process;
        if (current == null) {
            return;
        }
        stopping = true;
        long deadline = System.nanoTime() + timeout.toNanos();

        Thread forwarder = forwardThread;
        if (forwarder != null) {
            forwarder.interrupt();
        }
        if (current.isAlive()) {
            try {
                writeLine(mapper.writeValueAsString(Map.of("type", "SHUTDOWN")));
            } catch (IOException e) {
                log.debug("Could not send shutdown to unit '{}': {}", name, e.getMessage());
            }
        }
        try {
            closeStdin();
        } catch (IOException e) {
            log.debug("Could not close stdin of unit '{}': {}", name, e.getMessage());
        }

        if (!current.waitFor(remaining(deadline) / 2, TimeUnit.NANOSECONDS)) {
            log.debug("Process of unit '{}' ignored shutdown, destroying it", name);
            current.destroy();
            if (!current.waitFor(remaining(deadline) / 2, TimeUnit.NANOSECONDS)) {
                current.destroyForcibly();
                current.waitFor(remaining(deadline), TimeUnit.NANOSECONDS);
            }
        }
        if (current.isAlive()) {
            throw new IOException("Process of unit '" + name + "' did not terminate within " + timeout);
        }

        Thread drainer = drainThread;
        if (drainer != null) {
            drainer.join(Math.max(1, TimeUnit.NANOSECONDS.toMillis(remaining(deadline))));
        }
        log.info("Process of unit '{}' exited with code {}", name, current.exitValue());
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    @Override
    public boolean healthCheck() {
        Process current = process;
        if (current == null || !current.isAlive()) {
            return false;
        }
        Thread forwarder = forwardThread;
        if (forwarder == null || !forwarder.isAlive()) {
            return false;
        }
        Instant heartbeat = lastHeartbeat;
        return heartbeat != null && heartbeat.isAfter(Instant.now().minus(heartbeatTimeout));
    }

    /**
     * @return Time of the last heartbeat line, or of the start if none was received yet.
     */
    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public boolean isAlive() {
        Process current = process;
        return current != null && current.isAlive();
    }

    /**
     * @return Whether the child's stdin is still open for writing.
     */
    public boolean isInputOpen() {
        return stdin != null;
    }

    /**
     * @return Whether the child's stdout is still being read.
     */
    public boolean isOutputOpen() {
        Thread drainer = drainThread;
        return drainer != null && drainer.isAlive();
    }

    private void drainStdout(Process source) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(source.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                handleLine(line);
            }
        } catch (IOException e) {
            if (stopping) {
                log.debug("Output of unit '{}' closed: {}", name, e.getMessage());
            } else {
                log.warn("Lost output of unit '{}': {}", name, e.getMessage());
            }
        }
        if (!stopping) {
            log.warn("Process of unit '{}' closed its output", name);
        }
    }

    private void handleLine(String line) {
        if (line.isBlank()) {
            return;
        }
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed line from unit '{}': {}", name, e.getOriginalMessage());
            return;
        }
        String kind = node.path("kind").asText("");
        switch (kind) {
            case "heartbeat" -> {
                lastHeartbeat = Instant.now();
                bus.heartbeat(name);
            }
            case "response" -> {
                String messageId = node.path("messageId").asText("");
                try {
                    Object payload = mapper.treeToValue(node.get("payload"), Object.class);
                    if (!bus.respond(messageId, payload)) {
                        log.debug("Unit '{}' answered message {} after its sender gave up", name, messageId);
                    }
                } catch (JsonProcessingException e) {
                    log.warn("Ignoring unreadable response payload from unit '{}': {}", name, e.getOriginalMessage());
                }
            }
            default -> log.debug("Ignoring line of kind '{}' from unit '{}'", kind, name);
        }
    }

    private void forwardInbox() {
        try {
            while (!stopping && !Thread.currentThread().isInterrupted()) {
                if (!bus.isRegistered(name)) {
                    Thread.sleep(pollInterval.toMillis());
                    continue;
                }
                for (Message message : bus.poll(name, pollInterval, FORWARD_BATCH_SIZE)) {
                    String json;
                    try {
                        json = mapper.writeValueAsString(toLine(message));
                    } catch (JsonProcessingException e) {
                        log.warn("Skipping message {} for unit '{}': payload cannot be written as JSON: {}",
                                message.id(), name, e.getOriginalMessage());
                        continue;
                    }
                    writeLine(json);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (!stopping) {
                log.warn("Could not forward messages to unit '{}': {}", name, e.getMessage());
            }
        }
    }

    private Map<String, Object> toLine(Message message) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("type", message.type().name());
        line.put("id", message.id());
        line.put("priority", message.priority().name());
        line.put("sender", message.sender());
        line.put("recipient", message.recipient());
        line.put("payload", message.payload());
        line.put("createdAt", message.createdAt());
        line.put("requiresResponse", message.requiresResponse());
        line.put("correlationId", message.correlationId());
        return line;
    }

    private void writeLine(String json) throws IOException {
        synchronized (writeLock) {
            BufferedWriter writer = stdin;
            if (writer == null) {
                throw new IOException("stdin of unit '" + name + "' is closed");
            }
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    private void closeStdin() throws IOException {
        synchronized (writeLock) {
            BufferedWriter writer = stdin;
            stdin = null;
            if (writer != null) {
                writer.close();
            }
        }
    }
}
