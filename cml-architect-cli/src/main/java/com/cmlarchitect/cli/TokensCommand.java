package com.cmlarchitect.cli;

import com.cmlarchitect.core.parser.CmlToken;
import com.cmlarchitect.core.parser.CmlTokenizer;
import com.cmlarchitect.core.parser.SyntaxError;
import com.cmlarchitect.core.parser.TokenizeResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Command to print the token stream of a CML document, one token per line.
 */
@Command(
    name = "tokens",
    description = "Print the token stream of a CML document",
    mixinStandardHelpOptions = true
)
public class TokensCommand extends DocumentCommand implements Callable<Integer> {

    @Option(names = {"--json"}, description = "Print tokens and errors as JSON")
    private boolean json;

    @Override
    public Integer call() {
        try {
            TokenizeResult result = CmlTokenizer.tokenize(readDocument());
            if (json) {
                printJson(result);
            } else {
                for (CmlToken token : result.tokens()) {
                    out().println(token.line() + ":" + token.column() + "\t" + token.type() + "\t" + token.text());
                }
                for (SyntaxError error : result.errors()) {
                    err().println("✗ " + file + ": " + error);
                }
            }
            return result.isSuccess() ? EXIT_OK : EXIT_FAILURE;
        } catch (IOException e) {
            err().println("✗ Cannot read " + file + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
