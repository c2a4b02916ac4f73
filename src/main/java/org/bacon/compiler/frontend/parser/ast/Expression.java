package org.bacon.compiler.frontend.parser.ast;

/**
 * A node that produces a value.
 */
public sealed interface Expression extends AstNode
        permits IdentifierNode, IntegerLiteralNode, BooleanLiteralNode, PrefixExpressionNode,
        InfixExpressionNode, IfExpressionNode, FunctionLiteralNode, CallExpressionNode {
}
