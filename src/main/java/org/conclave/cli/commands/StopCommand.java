package org.conclave.cli.commands;

import org.conclave.cli.CommandLineInterface;
import org.conclave.lifecycle.ServiceLifecycleManager;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "stop", description = "Stops services and their dependents. Without names all services are stopped.")
public class StopCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-t", "--timeout"}, description = "Seconds to wait for each service (default: ${DEFAULT-VALUE}).",
            defaultValue = "10")
    private long timeoutSeconds;

    @Parameters(description = "The names of the services to stop.", arity = "0..*")
    private List<String> serviceNames;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        ServiceLifecycleManager manager = parent.getNode().getManager();
        if (serviceNames == null || serviceNames.isEmpty()) {
            boolean stopped = manager.stopAll();
            spec.commandLine().getOut().println(stopped ? "Stopped all services" : "Some services did not stop cleanly");
            return stopped ? 0 : 1;
        }
        boolean allStopped = true;
        for (String serviceName : serviceNames) {
            if (manager.stop(serviceName, Duration.ofSeconds(timeoutSeconds))) {
                spec.commandLine().getOut().printf("Stopped %s%n", serviceName);
            } else {
                spec.commandLine().getErr().printf("Could not stop %s%n", serviceName);
                allStopped = false;
            }
        }
        return allStopped ? 0 : 1;
    }
}
