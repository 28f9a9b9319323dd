package com.bank.reconciliation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Alerts from one risk analysis pass. {@code noAlerts} is set when the analysis ran
 * and nothing was found, as opposed to an analysis that has not happened yet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAnalysisResult {

    private List<RiskAlert> alerts;
    private boolean noAlerts;
    private Instant analyzedAt;
}
