package com.cmlarchitect;

import ch.qos.logback.classic.Level;
import com.cmlarchitect.cli.FormatCommand;
import com.cmlarchitect.cli.TokensCommand;
import com.cmlarchitect.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for CML Architect.
 *
 * <p>CML Architect reads Context Mapping Language documents, reports syntax and semantic
 * problems, and rewrites documents in canonical formatting.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Parse and validate a CML document</li>
 *   <li>{@code format} - Rewrite a CML document in canonical formatting</li>
 *   <li>{@code tokens} - Print the token stream of a CML document</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Validate a document, treating warnings as failures
 * cmlarchitect validate model.cml --fail-on-warnings
 *
 * # Format a document into a new file
 * cmlarchitect format model.cml -o formatted.cml
 *
 * # Check formatting in CI
 * cmlarchitect format model.cml --check
 * }</pre>
 */
@Command(
    name = "cmlarchitect",
    mixinStandardHelpOptions = true,
    version = "CML Architect 1.0.0-SNAPSHOT",
    description = "Parser, validator and formatter for Context Mapping Language documents",
    subcommands = {
        ValidateCommand.class,
        FormatCommand.class,
        TokensCommand.class
    }
)
public class CmlArchitectCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CmlArchitectCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        spec.commandLine().getOut().println("CML Architect - Context Mapping Language tooling");
        spec.commandLine().getOut().println("Use 'cmlarchitect --help' to see available commands");
    }

    /**
     * Configures logging, then runs the most specific command given on the command line.
     *
     * @param parseResult parsed command line
     * @return exit code
     */
    private int executionStrategy(CommandLine.ParseResult parseResult) {
        configureLogging();
        log.debug("Executing: {}", parseResult.originalArgs());
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.WARN);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        CmlArchitectCLI cli = new CmlArchitectCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
