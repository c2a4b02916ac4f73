package org.bacon.cli.commands;

import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Options shared by the commands that read a single source: either a file or an inline expression.
 */
public class SourceInput {

    @Option(names = {"-e", "--expression"}, description = "Source text to process instead of a file.")
    String expression;

    @Parameters(index = "0", arity = "0..1", paramLabel = "FILE", description = "The source file to process.")
    File file;

    /**
     * Reads the source text.
     *
     * @param spec The command the options belong to, used for usage errors.
     * @return The source text.
     * @throws CommandLine.ParameterException if neither or both of FILE and {@code -e} are given.
     * @throws IOException if the file cannot be read.
     */
    public String read(CommandSpec spec) throws IOException {
        if ((expression == null) == (file == null)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Exactly one of FILE or --expression must be given.");
        }
        if (expression != null) {
            return expression;
        }
        return Files.readString(file.toPath(), StandardCharsets.UTF_8);
    }

    /**
     * @return The name reported in diagnostics: the file name, or {@code <expression>}.
     */
    public String sourceName() {
        return file != null ? file.getName() : "<expression>";
    }
}
