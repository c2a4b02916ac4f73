package org.bacon.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.bacon.compiler.Frontend;
import org.bacon.compiler.frontend.lexer.Token;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Scans a source and prints its tokens, one per line or as a JSON array with {@code --json}.
 */
@Command(name = "tokens", mixinStandardHelpOptions = true, description = "Prints the tokens of a source file or expression.")
public class TokensCommand implements Callable<Integer> {

    @Mixin
    private SourceInput source;

    @Option(names = "--json", description = "Print the tokens as a JSON array.")
    private boolean json;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        List<Token> tokens = new Frontend().tokenize(source.read(spec));

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            out.println(gson.toJson(tokens));
        } else {
            tokens.forEach(out::println);
        }
        out.flush();
        return 0;
    }
}
