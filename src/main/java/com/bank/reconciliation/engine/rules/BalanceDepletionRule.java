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
import java.util.Comparator;
import java.util.List;

/**
 * Projects the balance forward through future-dated transactions and warns when it would go
 * negative within the horizon (90 days by default).
 *
 * The projection starts from the running balance of the earliest-dated record, or zero when
 * the ledger has not been recalculated yet. The alert carries no transaction ids.
 */
@Component
public class BalanceDepletionRule implements RiskRule {

    private final RiskThresholdConfig config;

    public BalanceDepletionRule(RiskThresholdConfig config) {
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.PROJECTED_BALANCE_RISK;
    }

    @Override
    public List<RiskAlert> evaluate(List<TransactionRecord> records, RuleContext context) {
        List<RiskAlert> alerts = new ArrayList<>();
        List<TransactionRecord> dated = new ArrayList<>();
        for (TransactionRecord record : records) {
            if (context.dateOf(record).isPresent()) {
                dated.add(record);
            }
        }
        if (dated.isEmpty()) {
            return alerts;
        }
        dated.sort(Comparator.comparing((TransactionRecord record) -> context.dateOf(record).orElseThrow())
                .thenComparing(TransactionRecord::getId, Comparator.nullsLast(Comparator.naturalOrder())));

        BigDecimal projected = dated.get(0).getRemainingBalance() != null
                ? dated.get(0).getRemainingBalance()
                : BigDecimal.ZERO;

        LocalDate today = context.getToday();
        LocalDate depletionDate = null;
        for (TransactionRecord record : dated) {
            LocalDate date = context.dateOf(record).orElseThrow();
            if (!date.isAfter(today)) {
                continue;
            }
            projected = projected.add(RuleSupport.signedAmountOf(record));
            if (projected.signum() < 0) {
                depletionDate = date;
                break;
            }
        }

        if (depletionDate == null) {
            return alerts;
        }
        long days = ChronoUnit.DAYS.between(today, depletionDate);
        if (days <= config.getRuleDefaults().getDepletionHorizonDays()) {
            alerts.add(RiskAlert.builder()
                    .severity(Severity.HIGH)
                    .type(AlertType.PROJECTED_BALANCE_RISK)
                    .message(String.format(
                            "Projected cash depletion within %d days based on upcoming expenses", days))
                    .transactionIds(new ArrayList<>())
                    .recommendedAction("Review upcoming expenses and adjust budget")
                    .build());
        }
        return alerts;
    }
}
