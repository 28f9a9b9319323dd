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

/**
 * Flags any transaction larger than a multiple (2x by default) of the mean positive amount.
 */
@Component
public class LargeTransactionRule implements RiskRule {

    private final RiskThresholdConfig config;

    public LargeTransactionRule(RiskThresholdConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.UNUSUALLY_LARGE_TRANSACTION;
    }

    @Override
    public List<RiskAlert> evaluate(List<TransactionRecord> records, RuleContext context) {
        List<RiskAlert> alerts = new ArrayList<>();
        double mean = records.stream()
                .mapToDouble(RuleSupport::amountOf)
                .filter(amount -> amount > 0)
                .average()
                .orElse(0.0);
        if (mean <= 0) {
            return alerts;
        }

        double threshold = mean * config.getRuleDefaults().getLargeTransactionMultiplier();
        for (TransactionRecord record : records) {
            double amount = RuleSupport.amountOf(record);
            if (amount > threshold) {
                alerts.add(RiskAlert.builder()
                        .severity(Severity.HIGH)
                        .type(AlertType.UNUSUALLY_LARGE_TRANSACTION)
                        .message(String.format(
                                "Transaction amount %.2f is unusually large compared to historical average of %.2f",
                                amount, mean))
                        .transactionIds(RuleSupport.idsOf(record))
                        .recommendedAction("Verify the transaction details and source")
                        .build());
            }
        }
        return alerts;
    }
}
