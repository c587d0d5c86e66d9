package dev.drtheo.jilox.util;

import dev.drtheo.jilox.lexer.Token;
import dev.drtheo.jilox.lexer.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LoxErrorTest {

    @Test
    @DisplayName("parse errors report line, lexeme and message")
    void parseReport() {
        ParseError error = new ParseError(3, "@", "Unexpected character.");

        assertThat(error.getKind()).isEqualTo(LoxError.Kind.PARSE);
        assertThat(error.report()).isEqualTo("Parse error: line 3, \"@\": Unexpected character.");
    }

    @Test
    @DisplayName("runtime errors take line and lexeme from their token")
    void runtimeReport() {
        Token plus = new Token(TokenType.PLUS, "+", null, 7);
        RuntimeError error = new RuntimeError(plus, "Incompatible types for '+': number and string.");

        assertThat(error.getKind()).isEqualTo(LoxError.Kind.RUNTIME);
        assertThat(error.getLine()).isEqualTo(7);
        assertThat(error.getLexeme()).isEqualTo("+");
        assertThat(error.getToken()).isSameAs(plus);
        assertThat(error.report())
                .isEqualTo("Runtime error: line 7, \"+\": Incompatible types for '+': number and string.");
    }

    @Test
    @DisplayName("errors at the end of input have an empty lexeme")
    void endOfInput() {
        ParseError error = new ParseError(new Token(TokenType.EOF, "", null, 2), "Expected expression.");

        assertThat(error.report()).isEqualTo("Parse error: line 2, \"\": Expected expression.");
    }
}
