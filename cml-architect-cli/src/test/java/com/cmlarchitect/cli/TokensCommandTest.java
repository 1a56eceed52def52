package com.cmlarchitect.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class TokensCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void tokens_printsPositionTypeAndText() throws IOException {
        Path file = tempDir.resolve("sales.cml");
        Files.writeString(file, "BoundedContext Sales {\n}");

        CliTestSupport.Run run = CliTestSupport.run("tokens", file.toString());

        assertThat(run.exitCode()).isZero();
        assertThat(run.out().lines()).containsExactly(
            "1:1\tBOUNDED_CONTEXT\tBoundedContext",
            "1:16\tID\tSales",
            "1:22\tLBRACE\t{",
            "2:1\tRBRACE\t}");
    }

    @Test
    void tokens_lexicalError_exitsOne() throws IOException {
        Path file = tempDir.resolve("odd.cml");
        Files.writeString(file, "BoundedContext Sales # { }");

        CliTestSupport.Run run = CliTestSupport.run("tokens", file.toString());

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err()).contains("line 1:22");
    }
}
