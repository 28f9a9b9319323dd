package com.bank.reconciliation.service;

import com.bank.reconciliation.config.MetricsConfig;
import com.bank.reconciliation.model.CategorySuggestion;
import com.bank.reconciliation.model.ConfidenceAnalysis;
import com.bank.reconciliation.model.DuplicateMatch;
import com.bank.reconciliation.model.ReconciliationResult;
import com.bank.reconciliation.model.TransactionRecord;
import com.bank.reconciliation.model.TransactionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Main orchestrator for a freshly extracted candidate record.
 *
 * Flow:
 * 1. Split a raw single amount into income / expense
 * 2. Auto-categorize when the category is blank, unknown or the fallback
 * 3. Analyze confidence and plausibility, setting the needs-review flag
 * 4. Compare against the existing records and link the best duplicate match
 * 5. Return the annotated record for the caller to persist
 *
 * The existing snapshot is only read. Ledger recalculation is left to the caller once the
 * record has been stored.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final Categorizer categorizer;
    private final ConfidenceAnalyzer confidenceAnalyzer;
    private final DuplicateDetector duplicateDetector;
    private final MetricsConfig metricsConfig;

    public ReconciliationService(Categorizer categorizer,
                                 ConfidenceAnalyzer confidenceAnalyzer,
                                 DuplicateDetector duplicateDetector,
                                 MetricsConfig metricsConfig) {
        this.categorizer = categorizer;
        this.confidenceAnalyzer = confidenceAnalyzer;
        this.duplicateDetector = duplicateDetector;
        this.metricsConfig = metricsConfig;
    }

    public ReconciliationResult reconcile(TransactionRecord candidate, List<TransactionRecord> existing) {
        Objects.requireNonNull(candidate, "candidate");

        // 1. Income / expense split
        splitAmount(candidate);

        // 2. Categorization
        CategorySuggestion suggestion = categorizer.suggestCategory(candidate.getVendor(), candidate.getNotes());
        if (needsCategory(candidate, suggestion)) {
            log.debug("Assigning category {} (confidence {}) to candidate from {}",
                    suggestion.getCategory(), suggestion.getConfidence(), candidate.getVendor());
            candidate.setCategory(suggestion.getCategory());
            if (candidate.getConfidence() != null) {
                candidate.getConfidence().setCategory(suggestion.getConfidence());
            }
        }

        // 3. Confidence and plausibility
        ConfidenceAnalysis analysis = confidenceAnalyzer.analyze(candidate);
        candidate.setNeedsReview(analysis.isNeedsReview());
        if (analysis.isNeedsReview()) {
            metricsConfig.recordReviewFlagged();
        }

        // 4. Duplicates
        List<DuplicateMatch> matches = duplicateDetector.findDuplicates(candidate, existing);
        Optional<DuplicateMatch> best = duplicateDetector.bestMatch(matches);
        if (best.isPresent()) {
            duplicateDetector.markAsDuplicate(candidate, best.get());
            metricsConfig.recordDuplicateDetected();
            log.info("Candidate from {} marked as duplicate of #{} (score {})",
                    candidate.getVendor(), best.get().getMatchedId(), best.get().getScore());
        }

        return ReconciliationResult.builder()
                .record(candidate)
                .analysis(analysis)
                .categorySuggestion(suggestion)
                .duplicates(matches)
                .duplicateSummary(duplicateDetector.summarize(matches))
                .build();
    }

    /**
     * Moves a raw single amount into the income or expense column according to the
     * transaction type. Records that already carry income or expense, and negative raw
     * amounts, are left untouched.
     */
    public TransactionRecord splitAmount(TransactionRecord record) {
        BigDecimal amount = record.getAmount();
        if (amount == null || amount.signum() <= 0
                || isPositive(record.getIncome()) || isPositive(record.getExpense())) {
            return record;
        }
        if (record.getTransactionType() == TransactionType.INCOME) {
            record.setIncome(amount);
            record.setExpense(BigDecimal.ZERO);
        } else {
            record.setExpense(amount);
            record.setIncome(BigDecimal.ZERO);
        }
        return record;
    }

    // Blank or unknown categories are replaced, as is the fallback when a keyword matched
    private boolean needsCategory(TransactionRecord candidate, CategorySuggestion suggestion) {
        if (!categorizer.isKnownCategory(candidate.getCategory())) {
            return true;
        }
        return categorizer.isFallbackCategory(candidate.getCategory())
                && !categorizer.isFallbackCategory(suggestion.getCategory());
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
