package com.bank.reconciliation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything the ingestion pipeline decided about one candidate record.
 * The caller persists {@code record}; the rest is for review screens.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {

    private TransactionRecord record;
    private ConfidenceAnalysis analysis;
    private CategorySuggestion categorySuggestion;
    private List<DuplicateMatch> duplicates;
    private String duplicateSummary;
}
