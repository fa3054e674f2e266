package org.conclave.cli.commands;

import org.conclave.cli.CommandLineInterface;
import org.conclave.lifecycle.ServiceLifecycleManager;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "resume", description = "Resumes paused services.")
public class ResumeCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(description = "The names of the services to resume.", arity = "1..*")
    private List<String> serviceNames;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        ServiceLifecycleManager manager = parent.getNode().getManager();
        boolean allDone = true;
        for (String serviceName : serviceNames) {
            if (manager.resume(serviceName)) {
                spec.commandLine().getOut().printf("Resumed %s%n", serviceName);
            } else {
                spec.commandLine().getErr().printf("Could not resume %s%n", serviceName);
                allDone = false;
            }
        }
        return allDone ? 0 : 1;
    }
}
