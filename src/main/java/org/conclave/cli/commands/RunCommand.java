package org.conclave.cli.commands;

import org.conclave.cli.CommandLineInterface;
import org.conclave.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(name = "run", description = "Starts all configured services and keeps them running.")
public class RunCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-i", "--interactive"}, description = "Open an interactive shell after startup.")
    private boolean interactive;

    @Override
    public Integer call() throws IOException, InterruptedException {
        if (parent.isNodeStarted()) {
            logger.warn("The node is already running.");
            return 1;
        }
        Node node = parent.getNode();
        if (!node.start()) {
            node.stop();
            return 1;
        }
        parent.setNodeStarted(true);

        if (interactive) {
            try {
                parent.runInteractiveShell();
            } finally {
                node.stop();
                parent.setNodeStarted(false);
            }
            return 0;
        }
        new CountDownLatch(1).await();
        return 0;
    }
}
