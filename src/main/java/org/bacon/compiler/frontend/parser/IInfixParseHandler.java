package org.bacon.compiler.frontend.parser;

import org.bacon.compiler.frontend.parser.ast.Expression;

/**
 * Parses the continuation of an expression whose left operand is already parsed,
 * e.g. a binary operator or the argument list of a call.
 */
@FunctionalInterface
public interface IInfixParseHandler {

    /**
     * Parses the continuation. On entry the current token is the operator the handler
     * is registered for; on exit the current token is the last token of the expression.
     *
     * @param context The parsing context providing the token stream and error reporting.
     * @param left The already parsed left operand. Never null.
     * @return The combined expression, or {@code null} if an error was reported.
     */
    Expression parse(ParsingContext context, Expression left);
}
