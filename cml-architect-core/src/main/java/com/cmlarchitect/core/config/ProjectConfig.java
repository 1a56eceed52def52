package com.cmlarchitect.core.config;

import com.cmlarchitect.core.writer.WriterConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for CML Architect.
 *
 * <p>Loaded from {@code cmlarchitect.yaml} next to the documents being processed.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * writer:
 *   indent: tab        # or a number of spaces, e.g. 4
 *
 * validation:
 *   failOnWarnings: true
 * }</pre>
 *
 * @param writer serialization settings
 * @param validation validation settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("writer") WriterSettings writer,
    @JsonProperty("validation") ValidationSettings validation
) {
    /**
     * Compact constructor applying defaults to missing sections.
     */
    public ProjectConfig {
        writer = writer == null ? WriterSettings.defaults() : writer;
        validation = validation == null ? ValidationSettings.defaults() : validation;
    }

    /**
     * Creates the default configuration: tab indentation, warnings do not fail validation.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(WriterSettings.defaults(), ValidationSettings.defaults());
    }

    /**
     * Writer settings.
     *
     * @param indent {@code tab} or a positive number of spaces
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WriterSettings(
        @JsonProperty("indent") String indent
    ) {
        /** Indent value selecting one tab per level. */
        public static final String TAB = "tab";

        public static WriterSettings defaults() {
            return new WriterSettings(TAB);
        }

        /**
         * Converts these settings into a {@link WriterConfig}.
         *
         * @return writer configuration
         * @throws IllegalArgumentException if the indent is neither {@code tab} nor a positive number
         */
        public WriterConfig toWriterConfig() {
            if (indent == null || indent.isBlank() || TAB.equalsIgnoreCase(indent.trim())) {
                return WriterConfig.defaults();
            }
            try {
                return WriterConfig.spaces(Integer.parseInt(indent.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "writer.indent must be 'tab' or a number of spaces, got '" + indent + "'", e);
            }
        }
    }

    /**
     * Validation settings.
     *
     * @param failOnWarnings whether warnings make a document fail validation
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationSettings(
        @JsonProperty("failOnWarnings") boolean failOnWarnings
    ) {
        public static ValidationSettings defaults() {
            return new ValidationSettings(false);
        }
    }
}
