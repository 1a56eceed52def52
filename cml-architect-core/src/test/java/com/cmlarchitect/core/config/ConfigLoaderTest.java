package com.cmlarchitect.core.config;

import com.cmlarchitect.core.writer.WriterConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            writer:
              indent: 4

            validation:
              failOnWarnings: true
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.writer().indent()).isEqualTo("4");
        assertThat(config.writer().toWriterConfig()).isEqualTo(WriterConfig.spaces(4));
        assertThat(config.validation().failOnWarnings()).isTrue();
    }

    @Test
    void load_partialYaml_defaultsMissingSections() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            validation:
              failOnWarnings: true
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.writer()).isEqualTo(ProjectConfig.WriterSettings.defaults());
        assertThat(config.validation().failOnWarnings()).isTrue();
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            writer:
              indent: tab
              lineEnding: crlf
            generators:
              default: mermaid
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.writer().toWriterConfig()).isEqualTo(WriterConfig.defaults());
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        Path nonExistentFile = tempDir.resolve("nonexistent.yaml");

        ProjectConfig config = ConfigLoader.load(nonExistentFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "");

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            writer: [unclosed
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
    }
}
