package dev.drtheo.jilox.util;

import dev.drtheo.jilox.lexer.Token;

/**
 * Raised for source text that cannot be scanned or token sequences that do not
 * match the grammar.
 */
public final class ParseError extends LoxError {

    public ParseError(Token token, String message) {
        super(token, message);
    }

    public ParseError(int line, String lexeme, String message) {
        super(line, lexeme, message);
    }

    @Override
    public Kind getKind() {
        return Kind.PARSE;
    }
}
