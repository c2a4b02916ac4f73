package org.bacon.compiler;

import org.bacon.compiler.api.ParseResult;
import org.bacon.compiler.diagnostics.DiagnosticsEngine;
import org.bacon.compiler.frontend.lexer.Lexer;
import org.bacon.compiler.frontend.lexer.Token;
import org.bacon.compiler.frontend.parser.Parser;
import org.bacon.compiler.frontend.parser.ast.ProgramNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point to the Bacon front end. Each call runs on a fresh lexer and parser,
 * so an instance can be shared; the lexer and parser themselves cannot.
 */
public class Frontend {

    private static final Logger log = LoggerFactory.getLogger(Frontend.class);

    /**
     * Scans a source completely.
     *
     * @param source The source text.
     * @return The tokens, ending with exactly one end-of-file token.
     */
    public List<Token> tokenize(String source) {
        return new Lexer(source).scanTokens();
    }

    /**
     * Parses a source.
     *
     * @param source The source text.
     * @param sourceName The name reported in diagnostics, e.g. a file name or {@code <repl>}.
     * @return The program and the errors reported while parsing it.
     */
    public ParseResult parse(String source, String sourceName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(sourceName);
        Parser parser = new Parser(new Lexer(source), diagnostics);
        ProgramNode program = parser.parseProgram();

        if (diagnostics.hasErrors()) {
            log.debug("Parsed {} with {} error(s):\n{}", sourceName, diagnostics.getDiagnostics().size(), diagnostics.summary());
        } else {
            log.debug("Parsed {}: {} statement(s)", sourceName, program.statements().size());
        }
        return new ParseResult(program, diagnostics.getDiagnostics());
    }
}
