package org.conclave.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.conclave.cli.CommandLineInterface;
import org.conclave.lifecycle.ServiceLifecycleManager;
import org.conclave.lifecycle.api.ServiceStatus;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "status", description = "Shows the status of the services.")
public class StatusCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = "--json", description = "Output the status in JSON format.")
    private boolean json;

    @Parameters(description = "Show only this service.", arity = "0..1")
    private String serviceName;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws JsonProcessingException {
        ServiceLifecycleManager manager = parent.getNode().getManager();
        PrintWriter out = spec.commandLine().getOut();

        Object report;
        if (serviceName != null) {
            Optional<ServiceStatus> status = manager.getServiceStatus(serviceName);
            if (status.isEmpty()) {
                spec.commandLine().getErr().printf("Unknown service: %s%n", serviceName);
                return 1;
            }
            report = status.get();
        } else {
            report = manager.getAllStatus().services();
        }

        if (json) {
            ObjectMapper mapper = new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .enable(SerializationFeature.INDENT_OUTPUT);
            out.println(mapper.writeValueAsString(report));
        } else if (report instanceof ServiceStatus single) {
            printService(single, out);
        } else {
            Map<String, ServiceStatus> services = manager.getAllStatus().services();
            if (services.isEmpty()) {
                out.println("No services are configured.");
            }
            services.values().forEach(status -> printService(status, out));
        }
        return 0;
    }

    private void printService(ServiceStatus status, PrintWriter out) {
        out.printf("Service: %s, State: %s, Errors: %d, Restarts: %d%s%n",
                status.name(), status.state(), status.errorCount(), status.restartCount(),
                status.stale() ? " (stale)" : "");
        if (!status.dependencies().isEmpty()) {
            out.printf("  Depends on: %s%n", String.join(", ", status.dependencies()));
        }
        if (!status.lastError().isEmpty()) {
            out.printf("  Last error: %s%n", status.lastError());
        }
    }
}
