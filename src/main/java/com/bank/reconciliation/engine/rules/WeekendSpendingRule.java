package com.bank.reconciliation.engine.rules;

import com.bank.reconciliation.config.RiskThresholdConfig;
import com.bank.reconciliation.engine.RiskRule;
import com.bank.reconciliation.engine.RuleContext;
import com.bank.reconciliation.model.AlertType;
import com.bank.reconciliation.model.RiskAlert;
import com.bank.reconciliation.model.Severity;
import com.bank.reconciliation.model.TransactionRecord;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compares average weekend and weekday transaction amounts. Only evaluated when both groups
 * have at least one dated transaction.
 */
@Component
public class WeekendSpendingRule implements RiskRule {

    private final RiskThresholdConfig config;

    public WeekendSpendingRule(RiskThresholdConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.WEEKEND_SPENDING_SPIKE;
    }

    @Override
    public List<RiskAlert> evaluate(List<TransactionRecord> records, RuleContext context) {
        List<TransactionRecord> weekend = new ArrayList<>();
        double weekendTotal = 0;
        double weekdayTotal = 0;
        int weekdayCount = 0;

        for (TransactionRecord record : records) {
            Optional<LocalDate> date = context.dateOf(record);
            if (date.isEmpty()) {
                continue;
            }
            if (isWeekend(date.get().getDayOfWeek())) {
                weekend.add(record);
                weekendTotal += RuleSupport.amountOf(record);
            } else {
                weekdayTotal += RuleSupport.amountOf(record);
                weekdayCount++;
            }
        }

        List<RiskAlert> alerts = new ArrayList<>();
        if (weekend.isEmpty() || weekdayCount == 0) {
            return alerts;
        }

        double weekendAverage = weekendTotal / weekend.size();
        double weekdayAverage = weekdayTotal / weekdayCount;
        if (weekendAverage > weekdayAverage * config.getRuleDefaults().getWeekendSpikeMultiplier()) {
            alerts.add(RiskAlert.builder()
                    .severity(Severity.LOW)
                    .type(AlertType.WEEKEND_SPENDING_SPIKE)
                    .message(String.format("Unusual spending spike on weekends: %.2f vs weekday average %.2f",
                            weekendAverage, weekdayAverage))
                    .transactionIds(RuleSupport.idsOf(weekend))
                    .recommendedAction("Review weekend transactions for unusual activity")
                    .build());
        }
        return alerts;
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
