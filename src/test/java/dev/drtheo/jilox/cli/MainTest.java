package dev.drtheo.jilox.cli;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MainTest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();

        commandLine = Main.newCommandLine(LoxConfig.defaults());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
    }

    private int execute(String... args) {
        return commandLine.execute(args);
    }

    @Nested
    @DisplayName("-e expression")
    class ExpressionTests {

        @Test
        @DisplayName("prints the value and exits with 0")
        void success() {
            assertThat(execute("-e", "1 + 2")).isZero();
            assertThat(out.toString().strip()).isEqualTo("3");
            assertThat(err.toString()).isEmpty();
        }

        @Test
        @DisplayName("parse errors exit with 65")
        void parseError() {
            assertThat(execute("-e", "(1 + 2")).isEqualTo(65);
            assertThat(err.toString()).contains("Parse error: line 1, \"\": Expected closing ')'.");
        }

        @Test
        @DisplayName("runtime errors exit with 70")
        void runtimeError() {
            assertThat(execute("-e", "1 + \"a\"")).isEqualTo(70);
            assertThat(err.toString()).contains("Runtime error: line 1, \"+\": Incompatible types");
        }

        @Test
        @DisplayName("--print-ast echoes the tree first")
        void printAst() {
            assertThat(execute("--print-ast", "-e", "3 * -(1.5)")).isZero();
            assertThat(out.toString().lines()).containsExactly("( * 3 (-(gr 1.5)) )", "-4.5");
        }
    }

    @Nested
    @DisplayName("script file")
    class ScriptTests {

        @TempDir
        Path dir;

        @Test
        @DisplayName("evaluates the file content")
        void runsFile() throws IOException {
            Path script = dir.resolve("concat.lox");
            Files.writeString(script, "// joins two strings\n\"lo\" + \"x\"\n", StandardCharsets.UTF_8);

            assertThat(execute(script.toString())).isZero();
            assertThat(out.toString().strip()).isEqualTo("lox");
        }

        @Test
        @DisplayName("reports diagnostics with their source line")
        void runtimeErrorLine() throws IOException {
            Path script = dir.resolve("broken.lox");
            Files.writeString(script, "1 +\n2 *\n-nil\n", StandardCharsets.UTF_8);

            assertThat(execute(script.toString())).isEqualTo(70);
            assertThat(err.toString()).contains("Runtime error: line 3, \"-\"");
        }

        @Test
        @DisplayName("missing files exit with 74")
        void missingFile() {
            assertThat(execute(dir.resolve("missing.lox").toString())).isEqualTo(74);
            assertThat(err.toString()).contains("Could not read");
        }
    }

    @Test
    @DisplayName("more than one script is a usage error")
    void tooManyArguments() {
        assertThat(execute("a.lox", "b.lox")).isEqualTo(64);
        assertThat(err.toString()).contains("Usage: jilox");
    }

    @Test
    @DisplayName("configured exit codes are used")
    void configuredExitCodes() {
        CommandLine custom = Main.newCommandLine(LoxConfig.of(ConfigFactory.parseString(
                "jilox.exit-codes { data-error = 3, usage = 2 }")));
        custom.setOut(new PrintWriter(new StringWriter(), true));
        custom.setErr(new PrintWriter(new StringWriter(), true));

        assertThat(custom.execute("-e", "(")).isEqualTo(3);
        assertThat(custom.execute("a", "b")).isEqualTo(2);
    }

    @Test
    @DisplayName("--version prints the version")
    void version() {
        assertThat(execute("--version")).isZero();
        assertThat(out.toString()).contains("jilox 1.0.0");
    }
}
