package dev.drtheo.jilox.parser;

import dev.drtheo.jilox.lexer.Token;
import dev.drtheo.jilox.lexer.TokenType;
import dev.drtheo.jilox.util.ParseError;

import java.util.List;
import java.util.function.Function;

import static dev.drtheo.jilox.lexer.TokenType.EOF;

/**
 * Forward-only cursor over a token sequence with one token of lookahead.
 * The sequence must end with {@link TokenType#EOF}; the cursor never moves past it.
 */
public class TokenEnumerator {

    protected final List<Token> tokens;
    private int current = 0;

    public TokenEnumerator(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(EOF))
            throw new IllegalArgumentException("Token sequence must end with " + EOF);

        this.tokens = List.copyOf(tokens);
    }

    protected boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (this.check(type)) {
                this.advance();
                return true;
            }
        }

        return false;
    }

    /**
     * Applies {@code consumer} to the current token, consuming it first when it
     * is one of {@code types}.
     */
    protected <R> R match(Function<Token, R> consumer, TokenType... types) {
        Token token = this.peek();
        this.match(types);

        return consumer.apply(token);
    }

    protected Token consume(TokenType type, String message) {
        if (this.check(type))
            return this.advance();

        throw error(message);
    }

    protected boolean check(TokenType type) {
        if (this.isAtEnd())
            return false;

        return this.peek().type() == type;
    }

    protected Token advance() {
        if (!this.isAtEnd())
            this.current++;

        return this.previous();
    }

    protected boolean isAtEnd() {
        return this.peek().type() == EOF;
    }

    protected Token peek() {
        return this.tokens.get(this.current);
    }

    protected Token previous() {
        return this.tokens.get(this.current - 1);
    }

    protected ParseError error(String message) {
        return error(this.peek(), message);
    }

    protected static ParseError error(Token token, String message) {
        return new ParseError(token, message);
    }
}
