package org.conclave.cli.commands;

import org.conclave.cli.CommandLineInterface;
import org.conclave.lifecycle.ServiceLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "restart", description = "Restarts services together with their running dependents.")
public class RestartCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(RestartCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(description = "The names of the services to restart. If none are specified, all services are restarted.", arity = "0..*")
    private List<String> serviceNames;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        ServiceLifecycleManager manager = parent.getNode().getManager();
        if (serviceNames == null || serviceNames.isEmpty()) {
            logger.info("Restarting all services...");
            manager.stopAll();
            return manager.startAll() ? 0 : 1;
        }
        boolean allRestarted = true;
        for (String serviceName : serviceNames) {
            logger.info("Restarting service: {}", serviceName);
            if (!manager.restart(serviceName)) {
                spec.commandLine().getErr().printf("Could not restart %s%n", serviceName);
                allRestarted = false;
            }
        }
        return allRestarted ? 0 : 1;
    }
}
