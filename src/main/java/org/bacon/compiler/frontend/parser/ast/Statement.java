package org.bacon.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A node that can appear in a statement list: at the top level of a program or inside a block.
 */
public sealed interface Statement extends AstNode
        permits LetStatementNode, ReturnStatementNode, ExpressionStatementNode, BlockStatementNode {

    /**
     * Renders a statement list so that it parses back into the same statements.
     * Every statement but the last is terminated by {@code ;} unless its rendering
     * already ends with one, and statements are separated by a single space.
     *
     * @param statements The statements in source order.
     * @return The joined rendering, empty for an empty list.
     */
    static String render(List<Statement> statements) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < statements.size(); i++) {
            String text = statements.get(i).toString();
            sb.append(text);
            if (i < statements.size() - 1) {
                if (!text.endsWith(";")) {
                    sb.append(';');
                }
                sb.append(' ');
            }
        }
        return sb.toString();
    }
}
