package com.bank.reconciliation.service;

import com.bank.reconciliation.config.CategoryConfig;
import com.bank.reconciliation.model.CategoryResult;
import com.bank.reconciliation.model.CategorySuggestion;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Assigns a category from vendor and notes text by weighted keyword matching.
 *
 * A keyword found in the vendor name earns 10 points; one found only in the notes earns 5.
 * The best (score, match count) wins; exact ties keep the configured category order.
 */
@Service
public class Categorizer {

    private static final int VENDOR_POINTS = 10;
    private static final int NOTES_POINTS = 5;
    private static final int MAX_ALTERNATIVES = 3;

    private final CategoryConfig config;

    public Categorizer(CategoryConfig config) {
        this.config = config;
    }

    public CategoryResult categorize(String vendor, String notes) {
        String vendorText = fold(vendor);
        String combined = vendorText + " " + fold(notes);

        String bestCategory = null;
        int bestScore = 0;
        int bestMatches = 0;

        for (Map.Entry<String, List<String>> entry : config.getKeywords().entrySet()) {
            if (isFallbackCategory(entry.getKey())) {
                continue;
            }

            int score = 0;
            int matches = 0;
            for (String keyword : entry.getValue()) {
                String needle = fold(keyword);
                if (needle.isEmpty()) {
                    continue;
                }
                if (vendorText.contains(needle)) {
                    score += VENDOR_POINTS;
                    matches++;
                } else if (combined.contains(needle)) {
                    score += NOTES_POINTS;
                    matches++;
                }
            }

            if (matches > 0 && (bestCategory == null
                    || score > bestScore
                    || (score == bestScore && matches > bestMatches))) {
                bestCategory = entry.getKey();
                bestScore = score;
                bestMatches = matches;
            }
        }

        if (bestCategory == null) {
            return CategoryResult.builder()
                    .category(config.getFallbackCategory())
                    .confidence(config.getFallbackConfidence())
                    .score(0)
                    .matches(0)
                    .build();
        }

        double confidence = Math.min(0.95, 0.6 + bestMatches * 0.1 + bestScore * 0.01);
        return CategoryResult.builder()
                .category(bestCategory)
                .confidence(confidence)
                .score(bestScore)
                .matches(bestMatches)
                .build();
    }

    public CategorySuggestion suggestCategory(String vendor, String notes) {
        CategoryResult result = categorize(vendor, notes);
        String vendorText = fold(vendor);
        String combined = vendorText + " " + fold(notes);

        List<String> matchedKeywords = new ArrayList<>();
        if (!isFallbackCategory(result.getCategory())) {
            for (String keyword : config.getKeywords().getOrDefault(result.getCategory(), List.of())) {
                String needle = fold(keyword);
                if (!needle.isEmpty() && combined.contains(needle)) {
                    matchedKeywords.add(keyword);
                }
            }
        }

        List<String> alternatives = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : config.getKeywords().entrySet()) {
            if (alternatives.size() >= MAX_ALTERNATIVES) {
                break;
            }
            if (isFallbackCategory(entry.getKey()) || entry.getKey().equals(result.getCategory())) {
                continue;
            }
            boolean matched = entry.getValue().stream()
                    .map(Categorizer::fold)
                    .anyMatch(needle -> !needle.isEmpty() && combined.contains(needle));
            if (matched) {
                alternatives.add(entry.getKey());
            }
        }

        String reasoning = matchedKeywords.isEmpty()
                ? "No strong matches found"
                : "Matched keywords: " + String.join(", ", matchedKeywords);

        return CategorySuggestion.builder()
                .category(result.getCategory())
                .confidence(result.getConfidence())
                .reasoning(reasoning)
                .matchedKeywords(matchedKeywords)
                .alternativeCategories(alternatives)
                .build();
    }

    public List<String> getAllCategories() {
        List<String> categories = new ArrayList<>(config.getKeywords().keySet());
        if (!categories.contains(config.getFallbackCategory())) {
            categories.add(config.getFallbackCategory());
        }
        return categories;
    }

    public boolean isKnownCategory(String category) {
        if (category == null || category.isBlank()) {
            return false;
        }
        return getAllCategories().stream().anyMatch(known -> known.equalsIgnoreCase(category.trim()));
    }

    public boolean isFallbackCategory(String category) {
        return category != null && config.getFallbackCategory().equalsIgnoreCase(category.trim());
    }

    private static String fold(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }
}
