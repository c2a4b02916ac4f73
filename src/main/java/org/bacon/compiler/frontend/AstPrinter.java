package org.bacon.compiler.frontend;

import org.bacon.compiler.frontend.parser.ast.AstNode;
import org.bacon.compiler.frontend.parser.ast.AstVisitor;
import org.bacon.compiler.frontend.parser.ast.BlockStatementNode;
import org.bacon.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.bacon.compiler.frontend.parser.ast.CallExpressionNode;
import org.bacon.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.bacon.compiler.frontend.parser.ast.FunctionLiteralNode;
import org.bacon.compiler.frontend.parser.ast.IdentifierNode;
import org.bacon.compiler.frontend.parser.ast.IfExpressionNode;
import org.bacon.compiler.frontend.parser.ast.InfixExpressionNode;
import org.bacon.compiler.frontend.parser.ast.IntegerLiteralNode;
import org.bacon.compiler.frontend.parser.ast.LetStatementNode;
import org.bacon.compiler.frontend.parser.ast.PrefixExpressionNode;
import org.bacon.compiler.frontend.parser.ast.ProgramNode;
import org.bacon.compiler.frontend.parser.ast.ReturnStatementNode;

/**
 * Renders an AST as an indented tree, one node per line, two spaces per level.
 * Unlike {@link Object#toString()} on the nodes, the output names every node type,
 * which makes it suitable for inspecting the parser's result.
 * <pre>
 * Program
 *   ExpressionStatement
 *     Infix +
 *       Identifier a
 *       Integer 1
 * </pre>
 */
public class AstPrinter implements AstVisitor<Void> {

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    /**
     * Renders the given node and all of its descendants.
     *
     * @param node The root of the subtree to render.
     * @return The tree rendering, each line terminated by a newline.
     */
    public static String print(AstNode node) {
        AstPrinter printer = new AstPrinter();
        node.accept(printer);
        return printer.out.toString();
    }

    private AstPrinter() {
    }

    @Override
    public Void visit(ProgramNode node) {
        line("Program");
        children(node.statements().toArray(AstNode[]::new));
        return null;
    }

    @Override
    public Void visit(LetStatementNode node) {
        line("Let " + node.name().name());
        children(node.value());
        return null;
    }

    @Override
    public Void visit(ReturnStatementNode node) {
        line("Return");
        children(node.value());
        return null;
    }

    @Override
    public Void visit(ExpressionStatementNode node) {
        line("ExpressionStatement");
        children(node.expression());
        return null;
    }

    @Override
    public Void visit(BlockStatementNode node) {
        line("Block");
        children(node.statements().toArray(AstNode[]::new));
        return null;
    }

    @Override
    public Void visit(IdentifierNode node) {
        line("Identifier " + node.name());
        return null;
    }

    @Override
    public Void visit(IntegerLiteralNode node) {
        line("Integer " + node.value());
        return null;
    }

    @Override
    public Void visit(BooleanLiteralNode node) {
        line("Boolean " + node.value());
        return null;
    }

    @Override
    public Void visit(PrefixExpressionNode node) {
        line("Prefix " + node.operator());
        children(node.right());
        return null;
    }

    @Override
    public Void visit(InfixExpressionNode node) {
        line("Infix " + node.operator());
        children(node.left(), node.right());
        return null;
    }

    @Override
    public Void visit(IfExpressionNode node) {
        line("If");
        children(node.condition(), node.consequence());
        if (node.hasAlternative()) {
            depth++;
            line("Else");
            children(node.alternative());
            depth--;
        }
        return null;
    }

    @Override
    public Void visit(FunctionLiteralNode node) {
        line("Function");
        children(node.parameters().toArray(AstNode[]::new));
        children(node.body());
        return null;
    }

    @Override
    public Void visit(CallExpressionNode node) {
        line("Call");
        children(node.function());
        children(node.arguments().toArray(AstNode[]::new));
        return null;
    }

    private void line(String text) {
        out.append("  ".repeat(depth)).append(text).append('\n');
    }

    private void children(AstNode... nodes) {
        depth++;
        for (AstNode child : nodes) {
            child.accept(this);
        }
        depth--;
    }
}
