package com.cmlarchitect.cli;

import com.cmlarchitect.core.config.ProjectConfig;
import com.cmlarchitect.core.parser.CmlModelParser;
import com.cmlarchitect.core.parser.ParseResult;
import com.cmlarchitect.core.parser.SyntaxError;
import com.cmlarchitect.core.validation.Diagnostic;
import com.cmlarchitect.core.validation.ModelValidator;
import com.cmlarchitect.core.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to parse and validate a CML document.
 *
 * <p>Exits with 1 when the document has syntax errors or validation errors, or warnings
 * while {@code --fail-on-warnings} (or {@code validation.failOnWarnings}) is set.
 */
@Command(
    name = "validate",
    description = "Parse and validate a CML document",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends DocumentCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Option(names = {"--fail-on-warnings"}, description = "Treat warnings as failures")
    private boolean failOnWarnings;

    @Option(names = {"--json"}, description = "Print the report as JSON")
    private boolean json;

    @Override
    public Integer call() {
        String text;
        try {
            text = readDocument();
        } catch (IOException e) {
            log.debug("Failed to read {}", file, e);
            err().println("✗ Cannot read " + file + ": " + e.getMessage());
            return EXIT_FAILURE;
        }

        ProjectConfig config = loadConfiguration();
        boolean warningsFail = failOnWarnings || config.validation().failOnWarnings();

        ParseResult parsed = CmlModelParser.parse(text);
        ValidationResult validation = parsed.success()
            ? new ModelValidator().validate(parsed.model())
            : null;
        boolean passed = parsed.success()
            && validation.valid()
            && !(warningsFail && !validation.warnings().isEmpty());

        try {
            if (json) {
                printJson(new Report(file.toString(), passed, parsed.errors(),
                    validation == null ? List.of() : validation.diagnostics()));
            } else {
                printText(parsed, validation, passed);
            }
        } catch (IOException e) {
            err().println("✗ Failed to write report: " + e.getMessage());
            return EXIT_FAILURE;
        }
        return passed ? EXIT_OK : EXIT_FAILURE;
    }

    private void printText(ParseResult parsed, ValidationResult validation, boolean passed) {
        if (!parsed.success()) {
            for (SyntaxError error : parsed.errors()) {
                err().println("✗ " + file + ": " + error);
            }
            err().println("✗ " + parsed.errors().size() + " syntax error(s)");
            return;
        }
        for (Diagnostic diagnostic : validation.diagnostics()) {
            String location = diagnostic.location() == null ? "" : " [" + diagnostic.location() + "]";
            String line = diagnostic.severity() + location + " " + diagnostic.message();
            if (diagnostic.isError()) {
                err().println(line);
            } else {
                out().println(line);
            }
        }
        String summary = validation.errors().size() + " error(s), " + validation.warnings().size() + " warning(s)";
        if (passed) {
            out().println("✓ " + file + " is valid (" + summary + ")");
        } else {
            err().println("✗ " + file + " is invalid (" + summary + ")");
        }
    }

    /**
     * JSON shape of a validation run.
     *
     * @param file validated file
     * @param passed whether the command succeeded
     * @param syntaxErrors lexical and syntax errors
     * @param diagnostics validation findings, empty when the document did not parse
     */
    public record Report(String file, boolean passed, List<SyntaxError> syntaxErrors, List<Diagnostic> diagnostics) {}
}
