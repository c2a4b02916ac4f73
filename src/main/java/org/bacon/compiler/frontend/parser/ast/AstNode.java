package org.bacon.compiler.frontend.parser.ast;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * Every node renders itself back to source-like text through {@link Object#toString()}.
 * Prefix and infix expressions are wrapped in parentheses, so the rendering shows
 * exactly how operators were bound. Blocks keep their braces and statements stay
 * separated, so parsing a rendering again yields an equivalent tree.
 */
public interface AstNode {

    /**
     * Returns the literal text of the token this node originates from.
     * @return The token text, e.g. {@code let} for a let statement or {@code +} for an addition.
     */
    String tokenLiteral();

    /**
     * Dispatches to the visitor method matching this node's concrete type.
     *
     * @param visitor The visitor to call.
     * @param <T> The result type of the visitor.
     * @return The visitor's result.
     */
    <T> T accept(AstVisitor<T> visitor);
}
