package com.cmlarchitect.core.parser;

import com.cmlarchitect.core.model.CmlModel;
import com.cmlarchitect.parser.CmlLexer;
import com.cmlarchitect.parser.CmlParser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Parses CML documents into {@link CmlModel}s.
 *
 * <p>The text is lexed and parsed with the ANTLR grammar {@code Cml.g4}. ANTLR's error
 * recovery keeps the parser going after a mismatch, so every lexical and syntax error of the
 * document ends up in the result. Only a document without errors is handed to the
 * {@link ModelBuilder}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ParseResult result = CmlModelParser.parse(Files.readString(path));
 * if (!result.success()) {
 *     result.errors().forEach(System.err::println);
 * }
 * }</pre>
 */
public final class CmlModelParser {

    private static final Logger log = LoggerFactory.getLogger(CmlModelParser.class);

    private CmlModelParser() {
        // Utility class
    }

    /**
     * Parses a CML document.
     *
     * @param text CML source
     * @return model on success, otherwise the full error list
     */
    public static ParseResult parse(String text) {
        Objects.requireNonNull(text, "text must not be null");

        CmlLexer lexer = new CmlLexer(CharStreams.fromString(text));
        CmlParser parser = new CmlParser(new CommonTokenStream(lexer));

        CollectingErrorListener lexerErrors = new CollectingErrorListener();
        CollectingErrorListener parserErrors = new CollectingErrorListener();
        lexer.removeErrorListeners();
        lexer.addErrorListener(lexerErrors);
        parser.removeErrorListeners();
        parser.addErrorListener(parserErrors);

        CmlParser.CmlModelContext tree = parser.cmlModel();

        if (lexerErrors.hasErrors() || parserErrors.hasErrors()) {
            List<SyntaxError> errors = new ArrayList<>(lexerErrors.getErrors());
            errors.addAll(parserErrors.getErrors());
            errors.sort(Comparator.comparingInt(SyntaxError::line).thenComparingInt(SyntaxError::column));
            log.debug("CML parse failed with {} error(s)", errors.size());
            return ParseResult.failure(errors);
        }

        CmlModel model = new ModelBuilder().build(tree);
        log.debug("Parsed CML model with {} bounded context(s)", model.boundedContexts().size());
        return ParseResult.success(model);
    }
}
