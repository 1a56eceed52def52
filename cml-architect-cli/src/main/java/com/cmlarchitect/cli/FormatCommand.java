package com.cmlarchitect.cli;

import com.cmlarchitect.core.config.ProjectConfig;
import com.cmlarchitect.core.parser.CmlModelParser;
import com.cmlarchitect.core.parser.ParseResult;
import com.cmlarchitect.core.parser.SyntaxError;
import com.cmlarchitect.core.writer.CmlWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to rewrite a CML document in canonical formatting.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print the formatted document
 * cmlarchitect format model.cml
 *
 * # Write it to a file
 * cmlarchitect format model.cml -o formatted.cml
 *
 * # Fail if the document is not formatted
 * cmlarchitect format model.cml --check
 * }</pre>
 */
@Command(
    name = "format",
    description = "Rewrite a CML document in canonical formatting",
    mixinStandardHelpOptions = true
)
public class FormatCommand extends DocumentCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @Option(names = {"-o", "--output"}, description = "Write the formatted document to this file")
    private Path output;

    @Option(names = {"--check"}, description = "Only check whether the document is formatted")
    private boolean check;

    @Override
    public Integer call() {
        try {
            String text = readDocument();
            ParseResult parsed = CmlModelParser.parse(text);
            if (!parsed.success()) {
                for (SyntaxError error : parsed.errors()) {
                    err().println("✗ " + file + ": " + error);
                }
                return EXIT_FAILURE;
            }

            ProjectConfig config = loadConfiguration();
            String formatted = new CmlWriter(config.writer().toWriterConfig()).serialize(parsed.model());

            if (check) {
                if (formatted.equals(text)) {
                    out().println("✓ " + file + " is formatted");
                    return EXIT_OK;
                }
                err().println("✗ " + file + " is not formatted");
                return EXIT_FAILURE;
            }

            if (output == null) {
                out().print(formatted);
                out().flush();
                return EXIT_OK;
            }

            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, formatted, StandardCharsets.UTF_8);
            log.debug("Wrote {} characters to {}", formatted.length(), output);
            out().println("✓ Wrote " + output);
            return EXIT_OK;
        } catch (IOException e) {
            log.debug("Format failed", e);
            err().println("✗ Format failed: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err().println("✗ Invalid configuration: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
