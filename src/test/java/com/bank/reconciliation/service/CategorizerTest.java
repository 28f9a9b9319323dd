package com.bank.reconciliation.service;

import com.bank.reconciliation.config.CategoryConfig;
import com.bank.reconciliation.model.CategoryResult;
import com.bank.reconciliation.model.CategorySuggestion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CategorizerTest {

    private Categorizer categorizer;

    @BeforeEach
    void setUp() {
        categorizer = new Categorizer(new CategoryConfig());
    }

    @Test
    void categorize_vendorKeyword() {
        CategoryResult result = categorizer.categorize("KFC Johar Town", null);

        assertThat(result.getCategory()).isEqualTo("Food");
        assertThat(result.getScore()).isEqualTo(10);
        assertThat(result.getMatches()).isEqualTo(1);
        assertThat(result.getConfidence()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void categorize_notesKeywordScoresLess() {
        CategoryResult result = categorizer.categorize("Qwerty Point", "petrol");

        assertThat(result.getCategory()).isEqualTo("Fuel");
        assertThat(result.getScore()).isEqualTo(5);
        assertThat(result.getConfidence()).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void categorize_transliteratedKeywords_confidenceCapped() {
        CategoryResult result = categorizer.categorize("Bijli ka bill", "");

        assertThat(result.getCategory()).isEqualTo("Utilities");
        assertThat(result.getMatches()).isEqualTo(2);
        assertThat(result.getConfidence()).isCloseTo(0.95, within(1e-9));
    }

    @Test
    void categorize_exactTieKeepsConfiguredOrder() {
        // "gas" is a keyword of both Fuel and Utilities
        assertThat(categorizer.categorize("Gas Station", null).getCategory()).isEqualTo("Fuel");
    }

    @Test
    void categorize_noMatch_returnsFallback() {
        CategoryResult result = categorizer.categorize("Zxq Mart", null);

        assertThat(result.getCategory()).isEqualTo("Other");
        assertThat(result.getConfidence()).isEqualTo(0.3);
        assertThat(result.getMatches()).isZero();
    }

    @Test
    void suggestCategory_reportsKeywordsAndAlternatives() {
        CategorySuggestion suggestion = categorizer.suggestCategory("PSO Gas Bill", null);

        assertThat(suggestion.getCategory()).isEqualTo("Fuel");
        assertThat(suggestion.getMatchedKeywords()).containsExactly("pso", "gas");
        assertThat(suggestion.getAlternativeCategories()).containsExactly("Utilities");
        assertThat(suggestion.getReasoning()).isEqualTo("Matched keywords: pso, gas");
    }

    @Test
    void suggestCategory_noMatch() {
        CategorySuggestion suggestion = categorizer.suggestCategory("Zxq Mart", "misc");

        assertThat(suggestion.getCategory()).isEqualTo("Other");
        assertThat(suggestion.getMatchedKeywords()).isEmpty();
        assertThat(suggestion.getAlternativeCategories()).isEmpty();
        assertThat(suggestion.getReasoning()).isEqualTo("No strong matches found");
    }

    @Test
    void knownCategories() {
        assertThat(categorizer.getAllCategories()).contains("Food", "Utilities", "Other").hasSize(11);
        assertThat(categorizer.isKnownCategory("food")).isTrue();
        assertThat(categorizer.isKnownCategory("Groceries")).isFalse();
        assertThat(categorizer.isKnownCategory(null)).isFalse();
        assertThat(categorizer.isFallbackCategory("other")).isTrue();
        assertThat(categorizer.isFallbackCategory("Food")).isFalse();
    }
}
