package com.cmlarchitect.core.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR error listener that records every reported error instead of printing it.
 *
 * <p>Registered on both the lexer and the parser so that all problems of a document are
 * reported in one pass.
 */
class CollectingErrorListener extends BaseErrorListener {

    private final List<SyntaxError> errors = new ArrayList<>();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer,
                            Object offendingSymbol,
                            int line,
                            int charPositionInLine,
                            String msg,
                            RecognitionException e) {
        // ANTLR columns are 0-based
        errors.add(new SyntaxError(msg, line, charPositionInLine + 1));
    }

    List<SyntaxError> getErrors() {
        return List.copyOf(errors);
    }

    boolean hasErrors() {
        return !errors.isEmpty();
    }
}
