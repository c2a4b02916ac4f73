package org.bacon.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Tokens are produced on demand, one per call to {@link #nextToken()}. The lexer
 * cannot be rewound; a new instance has to be created to scan the same input again.
 * It is not thread-safe.
 */
public class Lexer {

    private static final char END = '\0';

    private final String input;
    private int position = 0;
    private int readPosition = 0;
    private char ch = END;
    private int line = 1;
    private int column = 0;

    /**
     * Creates a new Lexer and loads the first character.
     * @param input The source code as a single string.
     */
    public Lexer(String input) {
        this.input = input;
        readChar();
    }

    /**
     * Scans the next token and advances past it. Once the end of the input is reached,
     * every further call returns an {@link TokenType#END_OF_FILE} token with empty text.
     *
     * @return The next token.
     */
    public Token nextToken() {
        skipWhitespace();

        int startLine = line;
        int startColumn = column;
        Token token;

        switch (ch) {
            case '=':
                if (peekChar() == '=') {
                    readChar();
                    token = new Token(TokenType.EQUAL, "==", startLine, startColumn);
                } else {
                    token = singleChar(TokenType.ASSIGN, startLine, startColumn);
                }
                break;
            case '!':
                if (peekChar() == '=') {
                    readChar();
                    token = new Token(TokenType.NOT_EQUAL, "!=", startLine, startColumn);
                } else {
                    token = singleChar(TokenType.BANG, startLine, startColumn);
                }
                break;
            case '+': token = singleChar(TokenType.PLUS, startLine, startColumn); break;
            case '-': token = singleChar(TokenType.MINUS, startLine, startColumn); break;
            case '*': token = singleChar(TokenType.ASTERISK, startLine, startColumn); break;
            case '/': token = singleChar(TokenType.SLASH, startLine, startColumn); break;
            case '<': token = singleChar(TokenType.LESS_THAN, startLine, startColumn); break;
            case '>': token = singleChar(TokenType.GREATER_THAN, startLine, startColumn); break;
            case ',': token = singleChar(TokenType.COMMA, startLine, startColumn); break;
            case ';': token = singleChar(TokenType.SEMICOLON, startLine, startColumn); break;
            case '(': token = singleChar(TokenType.LEFT_PAREN, startLine, startColumn); break;
            case ')': token = singleChar(TokenType.RIGHT_PAREN, startLine, startColumn); break;
            case '{': token = singleChar(TokenType.LEFT_BRACE, startLine, startColumn); break;
            case '}': token = singleChar(TokenType.RIGHT_BRACE, startLine, startColumn); break;
            case END:
                if (isAtEnd()) {
                    return new Token(TokenType.END_OF_FILE, "", startLine, startColumn);
                }
                token = singleChar(TokenType.ILLEGAL, startLine, startColumn);
                break;
            default:
                if (isLetter(ch)) {
                    // Identifiers and numbers stop on the first character that does not belong
                    // to them, which is already the current one, so no extra readChar().
                    String text = readIdentifier();
                    return new Token(TokenType.lookupIdentifier(text), text, startLine, startColumn);
                } else if (isDigit(ch)) {
                    return new Token(TokenType.INTEGER, readNumber(), startLine, startColumn);
                }
                token = singleChar(TokenType.ILLEGAL, startLine, startColumn);
                break;
        }

        readChar();
        return token;
    }

    /**
     * Drains the lexer into a list. The list always ends with exactly one
     * {@link TokenType#END_OF_FILE} token.
     *
     * @return All remaining tokens.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        return tokens;
    }

    private Token singleChar(TokenType type, int startLine, int startColumn) {
        return new Token(type, String.valueOf(ch), startLine, startColumn);
    }

    private void readChar() {
        if (ch == '\n') {
            line++;
            column = 0;
        }
        ch = readPosition >= input.length() ? END : input.charAt(readPosition);
        position = readPosition;
        readPosition++;
        column++;
    }

    private char peekChar() {
        if (readPosition >= input.length()) return END;
        return input.charAt(readPosition);
    }

    private String readIdentifier() {
        int start = position;
        while (isLetter(ch)) readChar();
        return input.substring(start, position);
    }

    private String readNumber() {
        int start = position;
        while (isDigit(ch)) readChar();
        return input.substring(start, position);
    }

    private void skipWhitespace() {
        while (ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r') {
            readChar();
        }
    }

    private boolean isAtEnd() {
        return position >= input.length();
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
