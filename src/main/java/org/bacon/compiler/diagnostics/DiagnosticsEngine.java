package org.bacon.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting the syntax errors
 * that occur during a single parse session.
 * <p>
 * This decouples error reporting from the actual parsing logic: nothing in the
 * parser throws on malformed input, everything ends up here instead.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final String sourceName;

    /**
     * Creates an engine for an anonymous in-memory source.
     */
    public DiagnosticsEngine() {
        this("<memory>");
    }

    /**
     * Creates an engine for a named source.
     * @param sourceName The name reported with every diagnostic, e.g. a file name or {@code <repl>}.
     */
    public DiagnosticsEngine(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param lineNumber The line number of the error.
     * @param column     The column of the error.
     */
    public void reportError(String message, int lineNumber, int column) {
        diagnostics.add(new Diagnostic(message, sourceName, lineNumber, column));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics, in reporting order.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns the plain messages of all reported errors, in reporting order.
     *
     * @return The error messages without position information.
     */
    public List<String> errorMessages() {
        return diagnostics.stream()
                .map(Diagnostic::message)
                .toList();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    public String getSourceName() {
        return sourceName;
    }
}
