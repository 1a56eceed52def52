package com.cmlarchitect.core.parser;

import com.cmlarchitect.parser.CmlLexer;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits CML source text into tokens.
 *
 * <p>Backed by the lexer generated from {@code Cml.g4}. Keywords never swallow the prefix of
 * a longer identifier: {@code ServiceNowPlatform} is a single {@code ID} token, not
 * {@code SERVICE} followed by {@code NowPlatform}. Unrecognized characters are reported with
 * their position and skipped, so one call reports every lexical error of the text.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TokenizeResult result = CmlTokenizer.tokenize("BoundedContext ServiceNowPlatform { }");
 * result.tokens().forEach(t -> System.out.println(t.type() + " " + t.text()));
 * }</pre>
 */
public final class CmlTokenizer {

    /** Symbolic type of generic identifiers. */
    public static final String IDENTIFIER = "ID";

    private CmlTokenizer() {
        // Utility class
    }

    /**
     * Tokenizes CML text.
     *
     * @param text CML source
     * @return tokens and lexical errors
     */
    public static TokenizeResult tokenize(String text) {
        Objects.requireNonNull(text, "text must not be null");

        CmlLexer lexer = new CmlLexer(CharStreams.fromString(text));
        CollectingErrorListener errorListener = new CollectingErrorListener();
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        List<CmlToken> tokens = new ArrayList<>();
        for (Token token = lexer.nextToken(); token.getType() != Token.EOF; token = lexer.nextToken()) {
            tokens.add(new CmlToken(
                CmlLexer.VOCABULARY.getSymbolicName(token.getType()),
                token.getText(),
                token.getLine(),
                token.getCharPositionInLine() + 1
            ));
        }
        return new TokenizeResult(tokens, errorListener.getErrors());
    }
}
