package org.bacon.compiler.diagnostics;

/**
 * Represents a single syntax error that occurs while parsing a source.
 *
 * @param message The human-readable diagnostic message.
 * @param sourceName The name of the source in which the issue occurred.
 * @param lineNumber The line number of the token that caused the issue.
 * @param column The column of the token that caused the issue.
 */
public record Diagnostic(
        String message,
        String sourceName,
        int lineNumber,
        int column
) {
    @Override
    public String toString() {
        return String.format("[ERROR] %s:%d:%d: %s", sourceName, lineNumber, column, message);
    }
}
