package com.proposalpilot.orchestrator.text;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordExtractorTest {

    @Test
    void tokens_lowercasedWithoutStopWordsShortWordsOrNumbers() {
        assertThat(KeywordExtractor.tokens("The 2025 Guide to AI for Warehouse Robotics in EU"))
                .containsExactly("warehouse", "robotics");
    }

    @Test
    void tokens_splitOnPunctuationAndDropDuplicates() {
        assertThat(KeywordExtractor.tokens("supply-chain: Supply/chain visibility"))
                .containsExactly("supply", "chain", "visibility");
    }

    @Test
    void tokens_nullOrBlank_empty() {
        assertThat(KeywordExtractor.tokens(null)).isEmpty();
        assertThat(KeywordExtractor.tokens("   ")).isEmpty();
    }

    @Test
    void topTerms_orderedByDocumentFrequencyThenAlphabetically() {
        List<String> texts = List.of(
                "freight routing optimisation",
                "routing for freight carriers",
                "demand sensing and routing");

        assertThat(KeywordExtractor.topTerms(texts, Set.of(), 3))
                .containsExactly("routing", "freight", "carriers");
    }

    @Test
    void topTerms_countsATermOncePerText() {
        List<String> texts = List.of("fleet fleet fleet", "telematics", "telematics data");

        assertThat(KeywordExtractor.topTerms(texts, Set.of(), 1)).containsExactly("telematics");
    }

    @Test
    void topTerms_skipsExcludedTerms() {
        assertThat(KeywordExtractor.topTerms(List.of("acme freight", "acme freight"), Set.of("acme"), 5))
                .containsExactly("freight");
    }

    @Test
    void mentionsAny_matchesWholeTokensOnly() {
        assertThat(KeywordExtractor.mentionsAny("Demand-forecasting toolkit", List.of("forecasting"))).isTrue();
        assertThat(KeywordExtractor.mentionsAny("Forecastingly", List.of("forecasting"))).isFalse();
    }
}
