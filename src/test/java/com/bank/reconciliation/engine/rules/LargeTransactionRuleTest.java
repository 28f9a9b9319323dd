package com.bank.reconciliation.engine.rules;

import com.bank.reconciliation.config.RiskThresholdConfig;
import com.bank.reconciliation.model.AlertType;
import com.bank.reconciliation.model.RiskAlert;
import com.bank.reconciliation.model.Severity;
import com.bank.reconciliation.model.TransactionRecord;
import com.bank.reconciliation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LargeTransactionRuleTest {

    private LargeTransactionRule rule;

    @BeforeEach
    void setUp() {
        rule = new LargeTransactionRule(new RiskThresholdConfig());
    }

    @Test
    void evaluate_amountAboveTwiceTheMean_flagged() {
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(1L, "2024-06-01", "KFC", "100"),
                TestDataFactory.createExpense(2L, "2024-06-02", "KFC", "100"),
                TestDataFactory.createExpense(3L, "2024-06-03", "KFC", "100"),
                TestDataFactory.createExpense(4L, "2024-06-04", "Laptop House", "1000"));

        List<RiskAlert> alerts = rule.evaluate(records, TestDataFactory.createRuleContext(records));

        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(alerts.get(0).getType()).isEqualTo(AlertType.UNUSUALLY_LARGE_TRANSACTION);
        assertThat(alerts.get(0).getTransactionIds()).containsExactly(4L);
    }

    @Test
    void evaluate_exactlyTwiceTheMean_notFlagged() {
        // mean 200, threshold 400
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(1L, "2024-06-01", "KFC", "100"),
                TestDataFactory.createExpense(2L, "2024-06-02", "KFC", "100"),
                TestDataFactory.createExpense(3L, "2024-06-03", "KFC", "400"),
                TestDataFactory.createExpense(4L, "2024-06-04", "KFC", "200"));

        assertThat(rule.evaluate(records, TestDataFactory.createRuleContext(records))).isEmpty();
    }

    @Test
    void evaluate_noPositiveAmounts_noAlerts() {
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(1L, "2024-06-01", "KFC", "0"));

        assertThat(rule.evaluate(records, TestDataFactory.createRuleContext(records))).isEmpty();
    }

    @Test
    void evaluate_incomeCountsTowardsMean() {
        List<TransactionRecord> records = List.of(
                TestDataFactory.createIncome(1L, "2024-06-01", "Client A", "5000"),
                TestDataFactory.createExpense(2L, "2024-06-02", "KFC", "100"),
                TestDataFactory.createExpense(3L, "2024-06-03", "KFC", "100"));

        List<RiskAlert> alerts = rule.evaluate(records, TestDataFactory.createRuleContext(records));

        assertThat(alerts).extracting(RiskAlert::getTransactionIds).containsExactly(List.of(1L));
    }
}
