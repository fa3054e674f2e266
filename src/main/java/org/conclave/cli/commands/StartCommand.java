package org.conclave.cli.commands;

import org.conclave.cli.CommandLineInterface;
import org.conclave.lifecycle.ServiceLifecycleManager;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "start", description = "Starts services. Without names all services are started in dependency order.")
public class StartCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(description = "The names of the services to start.", arity = "0..*")
    private List<String> serviceNames;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        ServiceLifecycleManager manager = parent.getNode().getManager();
        if (serviceNames == null || serviceNames.isEmpty()) {
            return report(manager.startAll(), "all services");
        }
        boolean allStarted = true;
        for (String serviceName : serviceNames) {
            allStarted &= report(manager.start(serviceName), serviceName) == 0;
        }
        return allStarted ? 0 : 1;
    }

    private int report(boolean success, String target) {
        if (success) {
            spec.commandLine().getOut().printf("Started %s%n", target);
            return 0;
        }
        spec.commandLine().getErr().printf("Could not start %s%n", target);
        return 1;
    }
}
