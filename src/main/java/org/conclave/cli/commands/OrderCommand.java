package org.conclave.cli.commands;

import org.conclave.cli.CommandLineInterface;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "order", description = "Prints the order in which the configured services would start.")
public class OrderCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        Optional<List<String>> order = parent.getNode().getManager().getStartOrder();
        if (order.isEmpty()) {
            spec.commandLine().getErr().println("The service dependencies contain a cycle.");
            return 1;
        }
        int position = 1;
        for (String name : order.get()) {
            out.printf("%d. %s%n", position++, name);
        }
        for (String skipped : parent.getNode().getSkippedServices()) {
            out.printf("skipped: %s%n", skipped);
        }
        return 0;
    }
}
