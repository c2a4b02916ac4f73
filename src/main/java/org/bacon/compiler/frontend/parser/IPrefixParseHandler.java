package org.bacon.compiler.frontend.parser;

import org.bacon.compiler.frontend.parser.ast.Expression;

/**
 * Parses an expression that starts with the current token, e.g. a literal, a unary
 * operator or an opening parenthesis.
 */
@FunctionalInterface
public interface IPrefixParseHandler {

    /**
     * Parses the expression. On entry the current token is the one the handler is
     * registered for; on exit the current token is the last token of the expression.
     *
     * @param context The parsing context providing the token stream and error reporting.
     * @return The parsed expression, or {@code null} if an error was reported.
     */
    Expression parse(ParsingContext context);
}
