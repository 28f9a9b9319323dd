package com.bank.reconciliation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateMatch {

    private Long matchedId;
    private TransactionRecord matchedRecord;
    private double score;
    private SimilarityScore breakdown;
}
