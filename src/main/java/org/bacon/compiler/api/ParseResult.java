package org.bacon.compiler.api;

import org.bacon.compiler.diagnostics.Diagnostic;
import org.bacon.compiler.frontend.parser.ast.ProgramNode;

import java.util.List;

/**
 * The outcome of parsing one source: the (possibly partial) program and the errors
 * reported on the way.
 *
 * @param program The parsed program. Never null; empty if nothing could be parsed.
 * @param diagnostics The reported errors in source order.
 */
public record ParseResult(
        ProgramNode program,
        List<Diagnostic> diagnostics
) {

    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return true if at least one error was reported, in which case the program may be partial.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return The error messages without position information.
     */
    public List<String> errors() {
        return diagnostics.stream().map(Diagnostic::message).toList();
    }
}
