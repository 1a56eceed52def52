package com.cmlarchitect.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FormatCommand}.
 */
class FormatCommandTest {

    private static final String MESSY = "BoundedContext Sales{Aggregate Orders{Entity Order{aggregateRoot String status}}}";

    private static final String FORMATTED = """
        BoundedContext Sales {

        \tAggregate Orders {

        \t\tEntity Order {
        \t\t\taggregateRoot
        \t\t\tString status
        \t\t}
        \t}
        }
        """;

    @TempDir
    Path tempDir;

    @Test
    void format_printsCanonicalText() throws IOException {
        Path file = tempDir.resolve("sales.cml");
        Files.writeString(file, MESSY);

        CliTestSupport.Run run = CliTestSupport.run("format", file.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).isEqualTo(FORMATTED);
    }

    @Test
    void format_withOutput_writesFile() throws IOException {
        Path file = tempDir.resolve("sales.cml");
        Files.writeString(file, MESSY);
        Path output = tempDir.resolve("out/formatted.cml");

        CliTestSupport.Run run = CliTestSupport.run("format", file.toString(), "-o", output.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("✓ Wrote " + output);
        assertThat(Files.readString(output)).isEqualTo(FORMATTED);
    }

    @Test
    void format_check_detectsUnformattedDocument() throws IOException {
        Path messy = tempDir.resolve("messy.cml");
        Files.writeString(messy, MESSY);
        Path clean = tempDir.resolve("clean.cml");
        Files.writeString(clean, FORMATTED);

        assertThat(CliTestSupport.run("format", "--check", messy.toString()).exitCode()).isEqualTo(1);
        assertThat(CliTestSupport.run("format", "--check", clean.toString()).exitCode()).isZero();
    }

    @Test
    void format_configIndent_usesSpaces() throws IOException {
        Path file = tempDir.resolve("sales.cml");
        Files.writeString(file, MESSY);
        Files.writeString(tempDir.resolve("cmlarchitect.yaml"), """
            writer:
              indent: 2
            """);

        CliTestSupport.Run run = CliTestSupport.run("format", file.toString());

        assertThat(run.out()).contains("\n  Aggregate Orders {\n").doesNotContain("\t");
    }

    @Test
    void format_invalidConfig_exitsOne() throws IOException {
        Path file = tempDir.resolve("sales.cml");
        Files.writeString(file, MESSY);
        Path config = tempDir.resolve("custom.yaml");
        Files.writeString(config, """
            writer:
              indent: wide
            """);

        CliTestSupport.Run run = CliTestSupport.run("format", file.toString(), "-c", config.toString());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err()).contains("✗ Invalid configuration: writer.indent must be 'tab' or a number of spaces");
    }

    @Test
    void format_syntaxError_exitsOne() throws IOException {
        Path file = tempDir.resolve("broken.cml");
        Files.writeString(file, "BoundedContext {");

        CliTestSupport.Run run = CliTestSupport.run("format", file.toString());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.out()).isEmpty();
    }
}
