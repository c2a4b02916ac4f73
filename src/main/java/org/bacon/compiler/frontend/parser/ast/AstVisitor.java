package org.bacon.compiler.frontend.parser.ast;

/**
 * A visitor for the Abstract Syntax Tree. Adding a node type adds a method here,
 * so every visitor has to handle it.
 *
 * @param <T> The return type of the visit methods.
 */
public interface AstVisitor<T> {
    T visit(ProgramNode node);
    T visit(LetStatementNode node);
    T visit(ReturnStatementNode node);
    T visit(ExpressionStatementNode node);
    T visit(BlockStatementNode node);
    T visit(IdentifierNode node);
    T visit(IntegerLiteralNode node);
    T visit(BooleanLiteralNode node);
    T visit(PrefixExpressionNode node);
    T visit(InfixExpressionNode node);
    T visit(IfExpressionNode node);
    T visit(FunctionLiteralNode node);
    T visit(CallExpressionNode node);
}
