package com.bank.reconciliation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Plausibility and confidence verdict for a single record.
 * Flags are plausibility failures; warnings are low per-field extraction confidence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfidenceAnalysis {

    private List<String> flags;
    private List<String> warnings;
    private double overallConfidence;
    private ConfidenceLevel level;
    private boolean needsReview;
}
