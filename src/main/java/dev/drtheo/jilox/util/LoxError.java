package dev.drtheo.jilox.util;

import dev.drtheo.jilox.lexer.Token;

/**
 * A diagnostic raised by one of the pipeline stages. Every stage stops at
 * its first error, so at most one of these escapes a scan, parse or evaluation.
 */
public abstract sealed class LoxError extends RuntimeException permits ParseError, RuntimeError {

    public enum Kind {
        PARSE("Parse error"),
        RUNTIME("Runtime error");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final int line;
    private final String lexeme;

    protected LoxError(int line, String lexeme, String message) {
        super(message);

        this.line = line;
        this.lexeme = lexeme;
    }

    protected LoxError(Token token, String message) {
        this(token.line(), token.lexeme(), message);
    }

    public abstract Kind getKind();

    public int getLine() {
        return line;
    }

    public String getLexeme() {
        return lexeme;
    }

    /**
     * @return the user facing form, e.g. {@code Runtime error: line 1, "+": Incompatible types ...}
     */
    public String report() {
        return this.getKind().getLabel() + ": line " + line + ", \"" + lexeme + "\": " + this.getMessage();
    }
}
