package org.bacon.cli.commands;

import org.bacon.cli.CommandLineInterface;
import org.bacon.cli.config.LoggingConfigurator;
import org.bacon.compiler.Frontend;
import org.bacon.repl.Repl;
import org.bacon.repl.ReplConfig;
import org.bacon.repl.ReplMode;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Starts the interactive loop on the system terminal, with the mode taken from the configuration unless {@code --mode} is given.
 */
@Command(name = "repl", mixinStandardHelpOptions = true, description = "Starts the interactive read-eval-print loop.")
public class ReplCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-m", "--mode"}, description = "Initial output mode: ${COMPLETION-CANDIDATES}. Default: from configuration.")
    private ReplMode mode;

    @Option(names = "--trace", description = "Log every parse step (BEGIN/END) at TRACE level.")
    private boolean trace;

    @Override
    public Integer call() throws Exception {
        ReplConfig replConfig = ReplConfig.fromConfig(parent.getConfig());
        if (mode != null) {
            replConfig = replConfig.withMode(mode);
        }
        if (trace) {
            LoggingConfigurator.enableParserTrace();
        }

        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(new DefaultHistory())
                    .build();
            PrintWriter out = terminal.writer();
            return new Repl(lineReader, out, new Frontend(), replConfig).run();
        }
    }
}
