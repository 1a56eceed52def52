package com.cmlarchitect.core.config;

import com.cmlarchitect.core.writer.WriterConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectConfigTest {

    @Test
    void constructor_nullSections_useDefaults() {
        ProjectConfig config = new ProjectConfig(null, null);

        assertThat(config).isEqualTo(ProjectConfig.defaults());
        assertThat(config.validation().failOnWarnings()).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"tab", "TAB", " tab "})
    void toWriterConfig_tabOrMissing_usesTab(String indent) {
        WriterConfig writerConfig = new ProjectConfig.WriterSettings(indent).toWriterConfig();

        assertThat(writerConfig.indent()).isEqualTo("\t");
    }

    @Test
    void toWriterConfig_number_usesSpaces() {
        WriterConfig writerConfig = new ProjectConfig.WriterSettings("2").toWriterConfig();

        assertThat(writerConfig.indent()).isEqualTo("  ");
    }

    @Test
    void toWriterConfig_text_isRejected() {
        assertThatThrownBy(() -> new ProjectConfig.WriterSettings("tabs").toWriterConfig())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("writer.indent must be 'tab' or a number of spaces, got 'tabs'");
    }

    @Test
    void toWriterConfig_zero_isRejected() {
        assertThatThrownBy(() -> new ProjectConfig.WriterSettings("0").toWriterConfig())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
