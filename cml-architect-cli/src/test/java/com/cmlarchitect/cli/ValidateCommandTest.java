package com.cmlarchitect.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    private static final String VALID = """
        BoundedContext Sales {
            Aggregate Orders {
                Entity Order {
                    aggregateRoot
                    - OrderId orderId key
                }
                ValueObject OrderId {
                    String value
                }
            }
        }
        """;

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void validate_validDocument_exitsZero() throws IOException {
        Path file = write("sales.cml", VALID);

        CliTestSupport.Run run = CliTestSupport.run("validate", file.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("✓ " + file + " is valid (0 error(s), 0 warning(s))");
        assertThat(run.err()).isEmpty();
    }

    @Test
    void validate_semanticError_exitsOne() throws IOException {
        Path file = write("sales.cml", """
            BoundedContext Sales {
                Aggregate Orders {
                    Entity Order {
                        aggregateRoot
                        Any payload
                    }
                }
            }
            """);

        CliTestSupport.Run run = CliTestSupport.run("validate", file.toString());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err())
            .contains("ERROR [Sales.Orders.Order] Invalid type for attribute 'payload'")
            .contains("is invalid (1 error(s), 0 warning(s))");
    }

    @Test
    void validate_syntaxError_reportsPosition() throws IOException {
        Path file = write("broken.cml", """
            BoundedContext Sales {
                Aggregate Orders {
            """);

        CliTestSupport.Run run = CliTestSupport.run("validate", file.toString());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err()).contains("✗ " + file + ": line ").contains("syntax error(s)");
    }

    @Test
    void validate_warningsOnly_passUnlessFlagged() throws IOException {
        Path file = write("empty.cml", "BoundedContext Sales { }");

        CliTestSupport.Run lenient = CliTestSupport.run("validate", file.toString());
        CliTestSupport.Run strict = CliTestSupport.run("validate", "--fail-on-warnings", file.toString());

        assertThat(lenient.exitCode()).isZero();
        assertThat(lenient.out()).contains("WARNING [Sales] Bounded context 'Sales' has no aggregates or modules");
        assertThat(strict.exitCode()).isEqualTo(1);
    }

    @Test
    void validate_configFailOnWarnings_appliesNextToDocument() throws IOException {
        Path file = write("empty.cml", "BoundedContext Sales { }");
        write("cmlarchitect.yaml", """
            validation:
              failOnWarnings: true
            """);

        CliTestSupport.Run run = CliTestSupport.run("validate", file.toString());

        assertThat(run.exitCode()).isEqualTo(1);
    }

    @Test
    void validate_json_printsReport() throws IOException {
        Path file = write("empty.cml", "BoundedContext Sales { }");

        CliTestSupport.Run run = CliTestSupport.run("validate", "--json", file.toString());

        JsonNode report = new ObjectMapper().readTree(run.out());
        assertThat(run.exitCode()).isZero();
        assertThat(report.get("passed").asBoolean()).isTrue();
        assertThat(report.get("syntaxErrors")).isEmpty();
        assertThat(report.get("diagnostics")).hasSize(1);
        assertThat(report.get("diagnostics").get(0).get("severity").asText()).isEqualTo("WARNING");
    }

    @Test
    void validate_missingFile_exitsOne() {
        CliTestSupport.Run run = CliTestSupport.run("validate", tempDir.resolve("missing.cml").toString());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err()).contains("Cannot read");
    }
}
