package com.bank.reconciliation.engine.rules;

import com.bank.reconciliation.config.RiskThresholdConfig;
import com.bank.reconciliation.engine.RiskRule;
import com.bank.reconciliation.engine.RuleContext;
import com.bank.reconciliation.model.AlertType;
import com.bank.reconciliation.model.RiskAlert;
import com.bank.reconciliation.model.Severity;
import com.bank.reconciliation.model.TransactionRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Detects sudden month-over-month swings in per-category spend.
 *
 * Amounts are summed per (month, category). Each pair of adjacent months present in the data
 * is compared; a category whose spend moved by more than the configured percentage (25% by
 * default) in either direction is flagged with the later month's transactions.
 * Records with unparseable dates are ignored.
 */
@Component
public class CategorySpendShiftRule implements RiskRule {

    private static final String UNCATEGORIZED = "Other";

    private final RiskThresholdConfig config;

    public CategorySpendShiftRule(RiskThresholdConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.SUDDEN_CATEGORY_CHANGE;
    }

    @Override
    public List<RiskAlert> evaluate(List<TransactionRecord> records, RuleContext context) {
        double maxChangePct = config.getRuleDefaults().getCategoryChangePct();
        Map<YearMonth, Map<String, Double>> monthlySpend = new TreeMap<>();
        Map<YearMonth, Map<String, List<TransactionRecord>>> monthlyRecords = new TreeMap<>();

        for (TransactionRecord record : records) {
            Optional<LocalDate> date = context.dateOf(record);
            if (date.isEmpty()) {
                continue;
            }
            YearMonth month = YearMonth.from(date.get());
            String category = categoryOf(record);
            monthlySpend.computeIfAbsent(month, m -> new TreeMap<>())
                    .merge(category, RuleSupport.amountOf(record), Double::sum);
            monthlyRecords.computeIfAbsent(month, m -> new TreeMap<>())
                    .computeIfAbsent(category, c -> new ArrayList<>())
                    .add(record);
        }

        List<RiskAlert> alerts = new ArrayList<>();
        List<YearMonth> months = new ArrayList<>(monthlySpend.keySet());
        for (int i = 1; i < months.size(); i++) {
            YearMonth previousMonth = months.get(i - 1);
            YearMonth currentMonth = months.get(i);
            Map<String, Double> previous = monthlySpend.get(previousMonth);
            Map<String, Double> current = monthlySpend.get(currentMonth);

            TreeSet<String> categories = new TreeSet<>(previous.keySet());
            categories.addAll(current.keySet());

            for (String category : categories) {
                double previousAmount = previous.getOrDefault(category, 0.0);
                double currentAmount = current.getOrDefault(category, 0.0);
                if (previousAmount <= 0) {
                    continue;
                }

                double changePct = (currentAmount - previousAmount) / previousAmount * 100.0;
                if (Math.abs(changePct) <= maxChangePct) {
                    continue;
                }

                List<TransactionRecord> currentRecords =
                        monthlyRecords.get(currentMonth).getOrDefault(category, List.of());
                List<Long> ids = RuleSupport.idsOf(currentRecords);
                if (ids.isEmpty()) {
                    continue;
                }

                alerts.add(RiskAlert.builder()
                        .severity(Severity.MEDIUM)
                        .type(AlertType.SUDDEN_CATEGORY_CHANGE)
                        .message(String.format("Sudden %.1f%% change in %s spending from %.2f to %.2f in %s",
                                changePct, category, previousAmount, currentAmount, currentMonth))
                        .transactionIds(ids)
                        .recommendedAction("Investigate the reason for the spending change")
                        .build());
            }
        }
        return alerts;
    }

    private static String categoryOf(TransactionRecord record) {
        String category = record.getCategory();
        return category == null || category.isBlank() ? UNCATEGORIZED : category.trim();
    }
}
