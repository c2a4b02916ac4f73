package org.bacon.compiler.frontend.parser;

import org.bacon.compiler.diagnostics.DiagnosticsEngine;
import org.bacon.compiler.frontend.lexer.Lexer;
import org.bacon.compiler.frontend.lexer.Token;
import org.bacon.compiler.frontend.lexer.TokenType;
import org.bacon.compiler.frontend.parser.ast.BlockStatementNode;
import org.bacon.compiler.frontend.parser.ast.Expression;
import org.bacon.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.bacon.compiler.frontend.parser.ast.IdentifierNode;
import org.bacon.compiler.frontend.parser.ast.LetStatementNode;
import org.bacon.compiler.frontend.parser.ast.ProgramNode;
import org.bacon.compiler.frontend.parser.ast.ReturnStatementNode;
import org.bacon.compiler.frontend.parser.ast.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The parser for the Bacon language. It pulls tokens from a {@link Lexer} and produces an
 * Abstract Syntax Tree (AST).
 * <p>
 * Statements are parsed by recursive descent. Expressions are parsed by precedence climbing:
 * each token type may have a prefix handler (the token begins an expression) and an infix
 * handler (the token continues one), looked up in a {@link ParseHandlerRegistry}.
 * <p>
 * Syntax errors never throw. They are reported to the {@link DiagnosticsEngine}, the smallest
 * enclosing statement is dropped, and parsing continues with the next token. The parser is
 * single-use and not thread-safe.
 * <p>
 * Nested constructs are parsed by recursion, so nesting depth is bounded by the JVM thread stack.
 */
public class Parser implements ParsingContext {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final Lexer lexer;
    private final DiagnosticsEngine diagnostics;
    private final ParseHandlerRegistry handlerRegistry;
    private Token currentToken;
    private Token peekToken;
    private int traceDepth = 0;

    /**
     * Constructs a new Parser that reports to a fresh, anonymous diagnostics engine.
     * @param lexer The lexer to pull tokens from.
     */
    public Parser(Lexer lexer) {
        this(lexer, new DiagnosticsEngine());
    }

    /**
     * Constructs a new Parser and fills the token window.
     * @param lexer The lexer to pull tokens from.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(Lexer lexer, DiagnosticsEngine diagnostics) {
        this.lexer = lexer;
        this.diagnostics = diagnostics;
        this.handlerRegistry = ParseHandlerRegistry.initialize();
        // First call fills peekToken, the second moves it into currentToken.
        nextToken();
        nextToken();
    }

    /**
     * Parses the whole token stream.
     * @return The program containing every statement that parsed without error. Never null.
     */
    public ProgramNode parseProgram() {
        List<Statement> statements = new ArrayList<>();
        while (!currentIs(TokenType.END_OF_FILE)) {
            Statement statement = parseStatement();
            if (statement != null) {
                statements.add(statement);
            }
            nextToken();
        }
        return new ProgramNode(statements);
    }

    /**
     * Returns the messages of all errors reported so far, in the order they occurred.
     * If the list is not empty, the program returned by {@link #parseProgram()} may be partial.
     *
     * @return The error messages.
     */
    public List<String> errors() {
        return diagnostics.errorMessages();
    }

    private Statement parseStatement() {
        switch (currentToken.type()) {
            case LET:
                return traced("parseLetStatement", this::parseLetStatement);
            case RETURN:
                return traced("parseReturnStatement", this::parseReturnStatement);
            default:
                return traced("parseExpressionStatement", this::parseExpressionStatement);
        }
    }

    private Statement parseLetStatement() {
        Token letToken = currentToken;

        if (!expectPeek(TokenType.IDENTIFIER)) {
            return null;
        }
        IdentifierNode name = new IdentifierNode(currentToken, currentToken.text());

        if (!expectPeek(TokenType.ASSIGN)) {
            return null;
        }
        nextToken();

        Expression value = parseExpression(Precedence.LOWEST);
        if (peekIs(TokenType.SEMICOLON)) {
            nextToken();
        }
        return value == null ? null : new LetStatementNode(letToken, name, value);
    }

    private Statement parseReturnStatement() {
        Token returnToken = currentToken;
        nextToken();

        Expression value = parseExpression(Precedence.LOWEST);
        if (peekIs(TokenType.SEMICOLON)) {
            nextToken();
        }
        return value == null ? null : new ReturnStatementNode(returnToken, value);
    }

    private Statement parseExpressionStatement() {
        Token firstToken = currentToken;

        Expression expression = parseExpression(Precedence.LOWEST);
        // The terminator is optional so that a single expression can be typed into the REPL.
        if (peekIs(TokenType.SEMICOLON)) {
            nextToken();
        }
        return expression == null ? null : new ExpressionStatementNode(firstToken, expression);
    }

    @Override
    public BlockStatementNode parseBlockStatement() {
        Token braceToken = currentToken;
        List<Statement> statements = new ArrayList<>();
        nextToken();

        while (!currentIs(TokenType.RIGHT_BRACE)) {
            if (currentIs(TokenType.END_OF_FILE)) {
                reportError(String.format("expected next token to be %s, got %s instead",
                        TokenType.RIGHT_BRACE.getDisplayName(), TokenType.END_OF_FILE.getDisplayName()), currentToken);
                return null;
            }
            Statement statement = parseStatement();
            if (statement != null) {
                statements.add(statement);
            }
            nextToken();
        }
        return new BlockStatementNode(braceToken, statements);
    }

    @Override
    public Expression parseExpression(Precedence precedence) {
        traceBegin("parseExpression");
        try {
            Optional<IPrefixParseHandler> prefix = handlerRegistry.getPrefix(currentToken.type());
            if (prefix.isEmpty()) {
                reportError(String.format("no prefix parse function for %s found",
                        currentToken.type().getDisplayName()), currentToken);
                return null;
            }
            Expression left = traced(prefix.get().getClass().getSimpleName(), () -> prefix.get().parse(this));

            // The left operand is absorbed by the next operator only if that operator binds
            // tighter than the one this expression is the right operand of.
            while (left != null && !peekIs(TokenType.SEMICOLON) && peekPrecedence().bindsTighterThan(precedence)) {
                Optional<IInfixParseHandler> infix = handlerRegistry.getInfix(peekToken.type());
                if (infix.isEmpty()) {
                    return left;
                }
                nextToken();

                Expression operand = left;
                left = traced(infix.get().getClass().getSimpleName(), () -> infix.get().parse(this, operand));
            }
            return left;
        } finally {
            traceEnd("parseExpression");
        }
    }

    @Override
    public boolean expectPeek(TokenType type) {
        if (peekIs(type)) {
            nextToken();
            return true;
        }
        reportError(String.format("expected next token to be %s, got %s instead",
                type.getDisplayName(), peekToken.type().getDisplayName()), peekToken);
        return false;
    }

    @Override
    public void nextToken() {
        currentToken = peekToken;
        peekToken = lexer.nextToken();
    }

    @Override
    public Token currentToken() {
        return currentToken;
    }

    @Override
    public Token peekToken() {
        return peekToken;
    }

    @Override
    public boolean currentIs(TokenType type) {
        return currentToken.type() == type;
    }

    @Override
    public boolean peekIs(TokenType type) {
        return peekToken.type() == type;
    }

    @Override
    public Precedence currentPrecedence() {
        return Precedence.of(currentToken.type());
    }

    private Precedence peekPrecedence() {
        return Precedence.of(peekToken.type());
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private void reportError(String message, Token at) {
        diagnostics.reportError(message, at.line(), at.column());
    }

    private <T> T traced(String name, Supplier<T> step) {
        traceBegin(name);
        try {
            return step.get();
        } finally {
            traceEnd(name);
        }
    }

    private void traceBegin(String name) {
        if (log.isTraceEnabled()) {
            log.trace("{}BEGIN {} at '{}'", "\t".repeat(traceDepth), name, currentToken.text());
        }
        traceDepth++;
    }

    private void traceEnd(String name) {
        traceDepth--;
        if (log.isTraceEnabled()) {
            log.trace("{}END {}", "\t".repeat(traceDepth), name);
        }
    }
}
