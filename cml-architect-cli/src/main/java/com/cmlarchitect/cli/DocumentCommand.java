package com.cmlarchitect.cli;

import com.cmlarchitect.core.config.ConfigLoader;
import com.cmlarchitect.core.config.ProjectConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Options and helpers shared by commands that read one CML document.
 */
abstract class DocumentCommand {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Parameters(index = "0", description = "CML document to read")
    Path file;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: cmlarchitect.yaml next to the document)"
    )
    Path configPath;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    String readDocument() throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    ProjectConfig loadConfiguration() {
        Path path = configPath;
        if (path == null) {
            Path directory = file.toAbsolutePath().getParent();
            path = directory == null
                ? Path.of(ConfigLoader.DEFAULT_FILE_NAME)
                : directory.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        }
        return ConfigLoader.load(path);
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    void printJson(Object value) throws JsonProcessingException {
        out().println(JSON_MAPPER.writeValueAsString(value));
    }
}
