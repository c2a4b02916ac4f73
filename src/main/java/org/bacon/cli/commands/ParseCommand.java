package org.bacon.cli.commands;

import org.bacon.cli.CommandLineInterface;
import org.bacon.cli.config.LoggingConfigurator;
import org.bacon.compiler.Frontend;
import org.bacon.compiler.api.ParseResult;
import org.bacon.compiler.diagnostics.Diagnostic;
import org.bacon.compiler.frontend.AstPrinter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Parses a source and prints the resulting program. Errors go to the error stream,
 * one per line with their position, and make the command exit with code 1.
 */
@Command(name = "parse", mixinStandardHelpOptions = true, description = "Parses a source file or expression and prints the syntax tree.")
public class ParseCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Mixin
    private SourceInput source;

    @Option(names = "--tree", description = "Print an indented node tree instead of the source rendering.")
    private boolean tree;

    @Option(names = "--trace", description = "Log every parse step (BEGIN/END) at TRACE level.")
    private boolean trace;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        if (parent != null) {
            parent.getConfig();
        }
        if (trace) {
            LoggingConfigurator.enableParserTrace();
        }

        ParseResult result = new Frontend().parse(source.read(spec), source.sourceName());

        PrintWriter out = spec.commandLine().getOut();
        if (tree) {
            out.print(AstPrinter.print(result.program()));
        } else {
            out.println(result.program());
        }
        out.flush();

        if (result.hasErrors()) {
            PrintWriter err = spec.commandLine().getErr();
            for (Diagnostic diagnostic : result.diagnostics()) {
                err.println(diagnostic);
            }
            err.flush();
            return 1;
        }
        return 0;
    }
}
