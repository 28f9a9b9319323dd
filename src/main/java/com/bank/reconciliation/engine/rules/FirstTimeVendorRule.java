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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags a vendor seen exactly once whose single transaction exceeds a multiple
 * (1.5x by default) of the mean amount across all transactions.
 */
@Component
public class FirstTimeVendorRule implements RiskRule {

    private final RiskThresholdConfig config;

    public FirstTimeVendorRule(RiskThresholdConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.FIRST_TIME_HIGH_VALUE_VENDOR;
    }

    @Override
    public List<RiskAlert> evaluate(List<TransactionRecord> records, RuleContext context) {
        List<RiskAlert> alerts = new ArrayList<>();
        double mean = records.stream().mapToDouble(RuleSupport::amountOf).average().orElse(0.0);
        double threshold = mean * config.getRuleDefaults().getFirstTimeVendorMultiplier();

        Map<String, List<TransactionRecord>> byVendor = new LinkedHashMap<>();
        for (TransactionRecord record : records) {
            byVendor.computeIfAbsent(RuleSupport.vendorKey(record), k -> new ArrayList<>()).add(record);
        }

        for (Map.Entry<String, List<TransactionRecord>> entry : byVendor.entrySet()) {
            if (entry.getKey().isEmpty() || entry.getValue().size() != 1) {
                continue;
            }
            TransactionRecord record = entry.getValue().get(0);
            double amount = RuleSupport.amountOf(record);
            if (amount > threshold) {
                alerts.add(RiskAlert.builder()
                        .severity(Severity.MEDIUM)
                        .type(AlertType.FIRST_TIME_HIGH_VALUE_VENDOR)
                        .message(String.format("First-time vendor %s with high value transaction of %.2f",
                                record.getVendor(), amount))
                        .transactionIds(RuleSupport.idsOf(record))
                        .recommendedAction("Verify the legitimacy of this new vendor transaction")
                        .build());
            }
        }
        return alerts;
    }
}
