package com.bank.reconciliation.service;

import com.bank.reconciliation.config.DuplicateDetectionConfig;
import com.bank.reconciliation.model.SimilarityScore;
import com.bank.reconciliation.model.TransactionRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;

/**
 * Scores how alike two transaction records are, field by field, on a 0-100 scale.
 *
 * Amount and vendor carry most of the weight since together they are the strongest
 * duplicate signal. Date corroborates, category barely counts because many unrelated
 * transactions share one.
 */
@Component
public class SimilarityScorer {

    private final DuplicateDetectionConfig config;
    private final DateNormalizer dateNormalizer;
    private final FuzzyStringMatcher stringMatcher;

    public SimilarityScorer(DuplicateDetectionConfig config,
                            DateNormalizer dateNormalizer,
                            FuzzyStringMatcher stringMatcher) {
        this.config = config;
        this.dateNormalizer = dateNormalizer;
        this.stringMatcher = stringMatcher;
    }

    public SimilarityScore score(TransactionRecord a, TransactionRecord b) {
        double amount = amountSimilarity(a, b);
        double vendor = vendorSimilarity(a, b);
        double date = dateSimilarity(a, b);
        double category = categorySimilarity(a, b);

        DuplicateDetectionConfig.Weights weights = config.getWeights();
        double overall = amount * weights.getAmount()
                + vendor * weights.getVendor()
                + date * weights.getDate()
                + category * weights.getCategory();

        return SimilarityScore.builder()
                .overall(clamp(overall))
                .amount(amount)
                .vendor(vendor)
                .date(date)
                .category(category)
                .build();
    }

    double amountSimilarity(TransactionRecord a, TransactionRecord b) {
        Optional<BigDecimal> first = a.magnitude();
        Optional<BigDecimal> second = b.magnitude();
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }

        BigDecimal x = first.get().abs();
        BigDecimal y = second.get().abs();
        if (x.compareTo(y) == 0) {
            return 100.0;
        }

        double diffPct = x.subtract(y).abs()
                .divide(x.max(y), MathContext.DECIMAL64)
                .doubleValue() * 100.0;
        if (diffPct <= 1.0) return 100.0;
        if (diffPct <= 5.0) return 90.0;
        if (diffPct <= 10.0) return 70.0;
        return Math.max(0.0, 100.0 - 1.5 * diffPct);
    }

    double vendorSimilarity(TransactionRecord a, TransactionRecord b) {
        String first = vendorText(a);
        String second = vendorText(b);
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        return stringMatcher.weightedRatio(first, second);
    }

    double dateSimilarity(TransactionRecord a, TransactionRecord b) {
        Optional<LocalDate> first = dateNormalizer.normalize(a.getDate());
        Optional<LocalDate> second = dateNormalizer.normalize(b.getDate());
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }

        long gap = Math.abs(ChronoUnit.DAYS.between(first.get(), second.get()));
        if (gap == 0) return 100.0;
        if (gap == 1) return 85.0;
        if (gap == 2) return 70.0;
        if (gap == 3) return 50.0;
        return Math.max(0.0, 100.0 - 15.0 * gap);
    }

    double categorySimilarity(TransactionRecord a, TransactionRecord b) {
        String first = fold(a.getCategory());
        String second = fold(b.getCategory());
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        return first.equals(second) ? 100.0 : 0.0;
    }

    // Vendor, falling back to notes and then the first line of the raw extracted text
    private static String vendorText(TransactionRecord record) {
        String vendor = fold(record.getVendor());
        if (!vendor.isEmpty()) {
            return vendor;
        }
        String notes = fold(record.getNotes());
        if (!notes.isEmpty()) {
            return notes;
        }
        String raw = record.getRawText();
        if (raw == null) {
            return "";
        }
        return fold(raw.strip().lines().findFirst().orElse(""));
    }

    private static String fold(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }
}
