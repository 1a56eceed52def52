package com.cmlarchitect.core.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CmlTokenizer}.
 */
class CmlTokenizerTest {

    @Test
    void tokenize_identifierStartingWithKeyword_isSingleIdentifier() {
        TokenizeResult result = CmlTokenizer.tokenize("BoundedContext ServiceNowPlatform { }");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.tokens()).extracting(CmlToken::type)
            .containsExactly("BOUNDED_CONTEXT", "ID", "LBRACE", "RBRACE");
        assertThat(result.tokens().get(1).text()).isEqualTo("ServiceNowPlatform");
        assertThat(result.tokens().get(1).isIdentifier()).isTrue();
    }

    @Test
    void tokenize_arrow_winsOverMinus() {
        TokenizeResult result = CmlTokenizer.tokenize("A -> B - C");

        assertThat(result.tokens()).extracting(CmlToken::type)
            .containsExactly("ID", "ARROW", "ID", "MINUS", "ID");
    }

    @Test
    void tokenize_bidirectionalArrow_isSingleToken() {
        TokenizeResult result = CmlTokenizer.tokenize("A <-> B");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.tokens()).extracting(CmlToken::type)
            .containsExactly("ID", "BIDIRECTIONAL", "ID");
        assertThat(result.tokens().get(1).text()).isEqualTo("<->");
    }

    @Test
    void tokenize_commentsAndWhitespace_areSkipped() {
        TokenizeResult result = CmlTokenizer.tokenize("""
            // line comment
            Entity /* block
               comment */ Customer
            """);

        assertThat(result.tokens()).extracting(CmlToken::text)
            .containsExactly("Entity", "Customer");
    }

    @Test
    void tokenize_tracksOneBasedPositions() {
        TokenizeResult result = CmlTokenizer.tokenize("Aggregate Orders {\n  Entity Order\n}");

        CmlToken entity = result.tokens().get(3);
        assertThat(entity.text()).isEqualTo("Entity");
        assertThat(entity.line()).isEqualTo(2);
        assertThat(entity.column()).isEqualTo(3);
    }

    @Test
    void tokenize_stringWithEscapes_isOneToken() {
        TokenizeResult result = CmlTokenizer.tokenize("domainVisionStatement = \"say \\\"hi\\\"\"");

        assertThat(result.tokens()).extracting(CmlToken::type)
            .containsExactly("DOMAIN_VISION_STATEMENT", "EQUALS", "STRING");
        assertThat(result.tokens().get(2).text()).isEqualTo("\"say \\\"hi\\\"\"");
    }

    @Test
    void tokenize_escapedKeyword_isIdentifier() {
        TokenizeResult result = CmlTokenizer.tokenize("String ^type");

        assertThat(result.tokens()).extracting(CmlToken::type).containsExactly("ID", "ID");
        assertThat(result.tokens().get(1).text()).isEqualTo("^type");
    }

    @Test
    void tokenize_unrecognizedCharacters_reportsEveryErrorAndContinues() {
        TokenizeResult result = CmlTokenizer.tokenize("Entity @Order\nEntity #Line");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errors()).hasSize(2);
        assertThat(result.errors().get(0).line()).isEqualTo(1);
        assertThat(result.errors().get(0).column()).isEqualTo(8);
        assertThat(result.errors().get(1).line()).isEqualTo(2);
        assertThat(result.tokens()).extracting(CmlToken::text)
            .containsExactly("Entity", "Order", "Entity", "Line");
    }
}
