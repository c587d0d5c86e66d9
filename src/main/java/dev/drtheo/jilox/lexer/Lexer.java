package dev.drtheo.jilox.lexer;

import dev.drtheo.jilox.util.ParseError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static dev.drtheo.jilox.lexer.TokenType.*;

/**
 * Turns source text into tokens. Scanning stops at the first character that
 * cannot start a token, or at a string or number literal that is malformed.
 * <p>
 * A lexer is single use: {@link #scanTokens()} consumes it.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        KEYWORDS.put("and", AND);
        KEYWORDS.put("class", CLASS);
        KEYWORDS.put("else", ELSE);
        KEYWORDS.put("false", FALSE);
        KEYWORDS.put("for", FOR);
        KEYWORDS.put("fun", FUN);
        KEYWORDS.put("if", IF);
        KEYWORDS.put("nil", NIL);
        KEYWORDS.put("or", OR);
        KEYWORDS.put("print", PRINT);
        KEYWORDS.put("return", RETURN);
        KEYWORDS.put("super", SUPER);
        KEYWORDS.put("this", THIS);
        KEYWORDS.put("true", TRUE);
        KEYWORDS.put("var", VAR);
        KEYWORDS.put("while", WHILE);
    }

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;

    public Lexer(String source) {
        this.source = source;
    }

    /**
     * The {@link TokenType#EOF} token sits where scanning stopped: on the line
     * counter after the last character has been consumed. A source ending in
     * a newline therefore puts EOF on the empty line that follows it.
     *
     * @return every token of the source followed by a single {@link TokenType#EOF}
     * @throws ParseError on the first unscannable character or malformed literal
     */
    public List<Token> scanTokens() {
        while (!this.isAtEnd()) {
            this.start = this.current;
            this.scanToken();
        }

        this.tokens.add(new Token(EOF, "", null, this.line));
        LOG.trace("Scanned {} tokens over {} line(s)", this.tokens.size(), this.line);

        return Collections.unmodifiableList(this.tokens);
    }

    private void scanToken() {
        char c = this.advance();

        switch (c) {
            case '(' -> this.addToken(LEFT_PAREN);
            case ')' -> this.addToken(RIGHT_PAREN);
            case '{' -> this.addToken(LEFT_BRACE);
            case '}' -> this.addToken(RIGHT_BRACE);
            case ',' -> this.addToken(COMMA);
            case '.' -> this.addToken(DOT);
            case '-' -> this.addToken(MINUS);
            case '+' -> this.addToken(PLUS);
            case ';' -> this.addToken(SEMICOLON);
            case '*' -> this.addToken(STAR);

            case '!' -> this.addToken(this.match('=') ? BANG_EQUAL : BANG);
            case '=' -> this.addToken(this.match('=') ? EQUAL_EQUAL : EQUAL);
            case '<' -> this.addToken(this.match('=') ? LESS_EQUAL : LESS);
            case '>' -> this.addToken(this.match('=') ? GREATER_EQUAL : GREATER);

            case '/' -> {
                if (this.match('/')) {
                    // A comment runs until the end of the line.
                    while (this.peek() != '\n' && !this.isAtEnd())
                        this.advance();
                } else {
                    this.addToken(SLASH);
                }
            }

            case ' ', '\r', '\t' -> { }
            case '\n' -> this.line++;

            case '"' -> this.string();

            default -> {
                if (isDigit(c)) {
                    this.number();
                } else if (isAlpha(c)) {
                    this.identifier();
                } else {
                    throw this.error("Unexpected character.");
                }
            }
        }
    }

    private void identifier() {
        while (isAlphaNumeric(this.peek()))
            this.advance();

        String text = this.source.substring(this.start, this.current);
        this.addToken(KEYWORDS.getOrDefault(text, IDENTIFIER));
    }

    private void number() {
        while (isDigit(this.peek()))
            this.advance();

        if (this.peek() == '.') {
            // Consume the "." and require a fraction after it.
            this.advance();

            if (!isDigit(this.peek()))
                throw this.error("Invalid number.");

            while (isDigit(this.peek()))
                this.advance();
        }

        String text = this.source.substring(this.start, this.current);

        try {
            this.addToken(NUMBER, Float.parseFloat(text));
        } catch (NumberFormatException e) {
            throw this.error("Invalid number.");
        }
    }

    private void string() {
        int startLine = this.line;

        while (this.peek() != '"' && !this.isAtEnd()) {
            if (this.peek() == '\n')
                this.line++;

            this.advance();
        }

        if (this.isAtEnd())
            throw new ParseError(startLine, this.source.substring(this.start, this.current), "Unterminated string.");

        // The closing ".
        this.advance();

        String value = this.source.substring(this.start + 1, this.current - 1);
        this.tokens.add(new Token(STRING, this.source.substring(this.start, this.current), value, startLine));
    }

    private boolean match(char expected) {
        if (this.isAtEnd())
            return false;

        if (this.source.charAt(this.current) != expected)
            return false;

        this.current++;
        return true;
    }

    private char peek() {
        if (this.isAtEnd())
            return '\0';

        return this.source.charAt(this.current);
    }

    private char advance() {
        return this.source.charAt(this.current++);
    }

    private boolean isAtEnd() {
        return this.current >= this.source.length();
    }

    private void addToken(TokenType type) {
        this.addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = this.source.substring(this.start, this.current);
        this.tokens.add(new Token(type, text, literal, this.line));
    }

    private ParseError error(String message) {
        return new ParseError(this.line, this.source.substring(this.start, this.current), message);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
