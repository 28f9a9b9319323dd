package com.bank.reconciliation.engine.rules;

import com.bank.reconciliation.config.RiskThresholdConfig;
import com.bank.reconciliation.engine.RiskRule;
import com.bank.reconciliation.engine.RuleContext;
import com.bank.reconciliation.model.AlertType;
import com.bank.reconciliation.model.RiskAlert;
import com.bank.reconciliation.model.Severity;
import com.bank.reconciliation.model.TransactionRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Proactive audit of extraction confidence. The cutoff (0.9) is deliberately stricter than the
 * ingestion warning threshold.
 */
@Component
public class LowConfidenceRule implements RiskRule {

    private final RiskThresholdConfig config;

    public LowConfidenceRule(RiskThresholdConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.LOW_CONFIDENCE_FIELDS;
    }

    @Override
    public List<RiskAlert> evaluate(List<TransactionRecord> records, RuleContext context) {
        double cutoff = config.getRuleDefaults().getLowConfidenceCutoff();
        List<RiskAlert> alerts = new ArrayList<>();

        for (TransactionRecord record : records) {
            if (record.getConfidence() == null) {
                continue;
            }
            List<String> lowFields = new ArrayList<>();
            for (Map.Entry<String, Double> field : record.getConfidence().asMap().entrySet()) {
                if (field.getValue() < cutoff) {
                    lowFields.add(field.getKey());
                }
            }
            if (lowFields.isEmpty()) {
                continue;
            }

            alerts.add(RiskAlert.builder()
                    .severity(Severity.MEDIUM)
                    .type(AlertType.LOW_CONFIDENCE_FIELDS)
                    .message(String.format("Low confidence in fields: %s for transaction %s",
                            String.join(", ", lowFields), record.getId()))
                    .transactionIds(RuleSupport.idsOf(record))
                    .recommendedAction("Review and correct the low-confidence fields")
                    .build());
        }
        return alerts;
    }
}
