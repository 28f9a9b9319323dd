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
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Points out expenses in deductible-looking categories above a minimal amount.
 * Categories compare case-insensitively, with spaces and hyphens read as underscores.
 */
@Component
public class TaxDeductibleRule implements RiskRule {

    private final RiskThresholdConfig config;

    public TaxDeductibleRule(RiskThresholdConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.POTENTIAL_TAX_DEDUCTIBLE;
    }

    @Override
    public List<RiskAlert> evaluate(List<TransactionRecord> records, RuleContext context) {
        RiskThresholdConfig.RuleDefaults defaults = config.getRuleDefaults();
        Set<String> deductible = defaults.getTaxDeductibleCategories().stream()
                .map(TaxDeductibleRule::normalize)
                .collect(Collectors.toSet());

        List<RiskAlert> alerts = new ArrayList<>();
        for (TransactionRecord record : records) {
            if (record.getCategory() == null || !deductible.contains(normalize(record.getCategory()))) {
                continue;
            }
            double amount = RuleSupport.amountOf(record);
            if (amount > defaults.getTaxDeductibleMinAmount()) {
                alerts.add(RiskAlert.builder()
                        .severity(Severity.LOW)
                        .type(AlertType.POTENTIAL_TAX_DEDUCTIBLE)
                        .message(String.format("Potential tax-deductible expense in category %s for amount %.2f",
                                record.getCategory(), amount))
                        .transactionIds(RuleSupport.idsOf(record))
                        .recommendedAction("Check if this expense qualifies for tax deduction")
                        .build());
            }
        }
        return alerts;
    }

    private static String normalize(String category) {
        return category.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }
}
