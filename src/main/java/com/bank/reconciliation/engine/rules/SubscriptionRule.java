package com.bank.reconciliation.engine.rules;

import com.bank.reconciliation.config.RiskThresholdConfig;
import com.bank.reconciliation.engine.RiskRule;
import com.bank.reconciliation.engine.RuleContext;
import com.bank.reconciliation.model.AlertType;
import com.bank.reconciliation.model.RiskAlert;
import com.bank.reconciliation.model.Severity;
import com.bank.reconciliation.model.TransactionRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects likely monthly subscriptions: at least three charges of an identical amount to the
 * same vendor whose average spacing falls in the monthly window (25 to 35 days by default).
 * A vendor with any undated charge is not evaluated.
 */
@Component
public class SubscriptionRule implements RiskRule {

    private final RiskThresholdConfig config;

    public SubscriptionRule(RiskThresholdConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.SUBSCRIPTION_DETECTED;
    }

    @Override
    public List<RiskAlert> evaluate(List<TransactionRecord> records, RuleContext context) {
        RiskThresholdConfig.RuleDefaults defaults = config.getRuleDefaults();
        Map<String, List<TransactionRecord>> byVendor = new LinkedHashMap<>();
        for (TransactionRecord record : records) {
            String key = RuleSupport.vendorKey(record);
            if (!key.isEmpty()) {
                byVendor.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
            }
        }

        List<RiskAlert> alerts = new ArrayList<>();
        for (List<TransactionRecord> group : byVendor.values()) {
            if (group.size() < defaults.getSubscriptionMinOccurrences() || !sameAmount(group)) {
                continue;
            }

            List<LocalDate> dates = new ArrayList<>();
            for (TransactionRecord record : group) {
                Optional<LocalDate> date = context.dateOf(record);
                if (date.isEmpty()) {
                    break;
                }
                dates.add(date.get());
            }
            if (dates.size() != group.size()) {
                continue;
            }
            Collections.sort(dates);

            double totalDays = 0;
            for (int i = 1; i < dates.size(); i++) {
                totalDays += ChronoUnit.DAYS.between(dates.get(i - 1), dates.get(i));
            }
            double averageInterval = totalDays / (dates.size() - 1);

            if (averageInterval >= defaults.getSubscriptionMinIntervalDays()
                    && averageInterval <= defaults.getSubscriptionMaxIntervalDays()) {
                TransactionRecord first = group.get(0);
                alerts.add(RiskAlert.builder()
                        .severity(Severity.LOW)
                        .type(AlertType.SUBSCRIPTION_DETECTED)
                        .message(String.format("Potential monthly subscription detected for %s with amount %s",
                                first.getVendor(), first.effectiveAmount().toPlainString()))
                        .transactionIds(RuleSupport.idsOf(group))
                        .recommendedAction("Confirm if this is a subscription and categorize accordingly")
                        .build());
            }
        }
        return alerts;
    }

    private static boolean sameAmount(List<TransactionRecord> group) {
        BigDecimal reference = group.get(0).effectiveAmount();
        return group.stream().allMatch(record -> record.effectiveAmount().compareTo(reference) == 0);
    }
}
