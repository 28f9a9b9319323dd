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

class DuplicateChargeRuleTest {

    private DuplicateChargeRule rule;

    @BeforeEach
    void setUp() {
        rule = new DuplicateChargeRule(TestDataFactory.createDuplicateDetector(), new RiskThresholdConfig());
    }

    @Test
    void evaluate_identicalCharges_reportedOnceWithAllIds() {
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(1L, "2024-06-01", "KFC Johar", "550"),
                TestDataFactory.createExpense(2L, "2024-06-01", "KFC Johar", "550"),
                TestDataFactory.createExpense(3L, "2024-06-05", "Careem", "1200", "Transport"));

        List<RiskAlert> alerts = rule.evaluate(records, TestDataFactory.createRuleContext(records));

        assertThat(alerts).hasSize(1);
        RiskAlert alert = alerts.get(0);
        assertThat(alert.getType()).isEqualTo(AlertType.DUPLICATE_CHARGES);
        assertThat(alert.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(alert.getTransactionIds()).containsExactlyInAnyOrder(1L, 2L);
        assertThat(alert.getMessage()).contains("KFC Johar").contains("550");
    }

    @Test
    void evaluate_similarButBelowStrictThreshold_notReported() {
        // A week apart: 40 + 40 + 0 + 5 = 85, a duplicate at ingestion but not here
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(1L, "2024-06-01", "KFC Johar", "550"),
                TestDataFactory.createExpense(2L, "2024-06-08", "KFC Johar", "550"));

        assertThat(rule.evaluate(records, TestDataFactory.createRuleContext(records))).isEmpty();
    }

    @Test
    void evaluate_threeWayCluster_singleAlert() {
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(1L, "2024-06-01", "Shell Clifton", "3000", "Fuel"),
                TestDataFactory.createExpense(2L, "2024-06-01", "Shell Clifton", "3000", "Fuel"),
                TestDataFactory.createExpense(3L, "2024-06-02", "Shell Clifton", "3000", "Fuel"));

        List<RiskAlert> alerts = rule.evaluate(records, TestDataFactory.createRuleContext(records));

        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getTransactionIds()).containsExactlyInAnyOrder(1L, 2L, 3L);
    }

    @Test
    void evaluate_identicalChargesWithoutIds_reportedOnce() {
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(null, "2024-01-10", "KFC Johar", "550"),
                TestDataFactory.createExpense(null, "2024-01-10", "KFC Johar", "550"));

        List<RiskAlert> alerts = rule.evaluate(records, TestDataFactory.createRuleContext(records));

        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getTransactionIds()).isEmpty();
    }
}
