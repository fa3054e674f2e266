package org.conclave.cli.commands;

import org.conclave.bus.api.BusStatistics;
import org.conclave.cli.CommandLineInterface;
import org.conclave.lifecycle.api.ManagerStatistics;
import org.conclave.lifecycle.api.ManagerStatus;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "stats", description = "Shows message bus and lifecycle counters.")
public class StatsCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        ManagerStatus status = parent.getNode().getManager().getAllStatus();
        ManagerStatistics manager = status.statistics();
        BusStatistics bus = status.bus();
        PrintWriter out = spec.commandLine().getOut();

        out.printf("Services: %d total, %d running, %d failed%n",
                status.totalServices(), status.runningServices(), status.failedServices());
        out.printf("Lifecycle: started=%d stopped=%d failed=%d restarts=%d startup=%s%n",
                manager.servicesStarted(), manager.servicesStopped(), manager.servicesFailed(),
                manager.totalRestarts(), manager.startupTime() != null ? manager.startupTime().toMillis() + "ms" : "-");
        out.printf("Bus: sent=%d received=%d dropped=%d evicted=%d rejected=%d responded=%d timedOut=%d units=%d pending=%d%n",
                bus.sent(), bus.received(), bus.dropped(), bus.evicted(), bus.rejected(),
                bus.responded(), bus.timedOut(), bus.activeUnits(), bus.pendingResponses());
        return 0;
    }
}
