package dev.drtheo.jilox.util;

import dev.drtheo.jilox.lexer.Token;

public final class RuntimeError extends LoxError {

    private final Token token;

    public RuntimeError(Token token, String message) {
        super(token, message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }

    @Override
    public Kind getKind() {
        return Kind.RUNTIME;
    }
}
