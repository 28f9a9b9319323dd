package com.bank.reconciliation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Similarity between two records. Every value is on a 0-100 scale.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarityScore {

    private double overall;
    private double amount;
    private double vendor;
    private double date;
    private double category;
}
