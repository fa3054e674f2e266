package org.conclave.cli;

import com.typesafe.config.Config;
import org.conclave.cli.commands.OrderCommand;
import org.conclave.cli.commands.PauseCommand;
import org.conclave.cli.commands.RestartCommand;
import org.conclave.cli.commands.ResumeCommand;
import org.conclave.cli.commands.RunCommand;
import org.conclave.cli.commands.StartCommand;
import org.conclave.cli.commands.StatsCommand;
import org.conclave.cli.commands.StatusCommand;
import org.conclave.cli.commands.StopCommand;
import org.conclave.node.Node;
import org.conclave.node.config.ConfigLoader;
import org.conclave.node.config.LoggingConfigurator;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.ParsedLine;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(name = "conclave", mixinStandardHelpOptions = true,
        version = "Conclave 1.0",
        description = "Runs and operates a Conclave node.",
        subcommands = {
                RunCommand.class,
                OrderCommand.class,
                StatusCommand.class,
                StartCommand.class,
                StopCommand.class,
                RestartCommand.class,
                PauseCommand.class,
                ResumeCommand.class,
                StatsCommand.class
        })
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);
    private static final Set<String> SHELL_HIDDEN_COMMANDS = Set.of("run");

    @Option(names = {"-c", "--config"}, description = "Path to the configuration file.")
    private File configFile;

    private Config config;
    private Node node;
    private boolean nodeStarted = false;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public CommandLineInterface() {
        // production entry
    }

    /**
     * Creates an interface that operates an existing node, used by tests.
     *
     * @param node The node the commands act on.
     */
    public CommandLineInterface(Node node) {
        this.node = node;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * @return The loaded configuration; logging levels are applied on first load.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * @return The node the commands act on, created from the configuration on first use.
     */
    public Node getNode() {
        if (node == null) {
            node = new Node(getConfig());
        }
        return node;
    }

    public boolean isNodeStarted() {
        return nodeStarted;
    }

    public void setNodeStarted(boolean nodeStarted) {
        this.nodeStarted = nodeStarted;
    }

    /**
     * Reads commands from the terminal until {@code exit}, {@code quit} or end of input.
     *
     * @throws IOException if the terminal cannot be opened.
     */
    public void runInteractiveShell() throws IOException {
        CommandLine cmd = new CommandLine(this);
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .completer(new SimpleCommandCompleter(cmd))
                    .build();

            while (true) {
                String line;
                try {
                    line = lineReader.readLine("conclave> ");
                } catch (UserInterruptException e) {
                    log.debug("Ctrl-C ignored, type 'exit' to leave the shell");
                    continue;
                } catch (EndOfFileException e) {
                    return;
                }
                if (line == null || "exit".equalsIgnoreCase(line.trim()) || "quit".equalsIgnoreCase(line.trim())) {
                    return;
                }
                if (!line.trim().isEmpty()) {
                    cmd.execute(line.trim().split("\\s+"));
                }
            }
        }
    }

    private static class SimpleCommandCompleter implements Completer {
        private final CommandLine cmd;

        SimpleCommandCompleter(CommandLine cmd) {
            this.cmd = cmd;
        }

        @Override
        public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
            if (line.wordIndex() != 0) {
                return;
            }
            String word = line.word();
            for (String commandName : cmd.getSubcommands().keySet()) {
                if (commandName.startsWith(word) && !SHELL_HIDDEN_COMMANDS.contains(commandName)) {
                    candidates.add(new Candidate(commandName));
                }
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CommandLineInterface()).execute(args);
        System.exit(exitCode);
    }
}
