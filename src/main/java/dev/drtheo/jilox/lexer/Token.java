package dev.drtheo.jilox.lexer;

/**
 * A scanned lexeme. Only {@link TokenType#STRING} and {@link TokenType#NUMBER}
 * tokens carry a decoded literal: a {@link String} or a {@link Float}.
 */
public record Token(TokenType type, String lexeme, Object literal, int line) {

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public String toString() {
        return type + " " + lexeme + " " + literal;
    }
}
