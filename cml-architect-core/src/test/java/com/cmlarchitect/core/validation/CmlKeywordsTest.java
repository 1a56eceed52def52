package com.cmlarchitect.core.validation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CmlKeywords}.
 */
class CmlKeywordsTest {

    @Test
    void isReservedAttributeName_ignoresCase() {
        assertThat(CmlKeywords.isReservedAttributeName("query")).isTrue();
        assertThat(CmlKeywords.isReservedAttributeName("Query")).isTrue();
        assertThat(CmlKeywords.isReservedAttributeName("TYPE")).isTrue();
        assertThat(CmlKeywords.isReservedAttributeName("customerName")).isFalse();
    }

    @Test
    void isReservedAttributeName_includesGrammarKeywords() {
        assertThat(CmlKeywords.isReservedAttributeName("OHS")).isTrue();
        assertThat(CmlKeywords.isReservedAttributeName("sharedKernel")).isTrue();
        assertThat(CmlKeywords.isReservedAttributeName("downstreamRights")).isTrue();
    }

    @Test
    void isGrammarKeyword_isCaseSensitive() {
        assertThat(CmlKeywords.isGrammarKeyword("Entity")).isTrue();
        assertThat(CmlKeywords.isGrammarKeyword("U")).isTrue();
        assertThat(CmlKeywords.isGrammarKeyword("AS_IS")).isTrue();
        assertThat(CmlKeywords.isGrammarKeyword("entity")).isFalse();
        assertThat(CmlKeywords.isGrammarKeyword("Order")).isFalse();
        assertThat(CmlKeywords.isGrammarKeyword("->")).isFalse();
    }
}
