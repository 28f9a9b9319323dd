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

class CategorySpendShiftRuleTest {

    private CategorySpendShiftRule rule;

    @BeforeEach
    void setUp() {
        rule = new CategorySpendShiftRule(new RiskThresholdConfig());
    }

    @Test
    void evaluate_spendDoubledMonthOverMonth_flagsCurrentMonthRecords() {
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(1L, "2024-05-10", "KFC", "100", "Food"),
                TestDataFactory.createExpense(2L, "2024-06-03", "KFC", "120", "Food"),
                TestDataFactory.createExpense(3L, "2024-06-09", "Dhaba", "80", "Food"));

        List<RiskAlert> alerts = rule.evaluate(records, TestDataFactory.createRuleContext(records));

        assertThat(alerts).hasSize(1);
        RiskAlert alert = alerts.get(0);
        assertThat(alert.getType()).isEqualTo(AlertType.SUDDEN_CATEGORY_CHANGE);
        assertThat(alert.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(alert.getTransactionIds()).containsExactly(2L, 3L);
        assertThat(alert.getMessage()).contains("Food").contains("2024-06");
    }

    @Test
    void evaluate_smallChange_notFlagged() {
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(1L, "2024-05-10", "KFC", "100", "Food"),
                TestDataFactory.createExpense(2L, "2024-06-10", "KFC", "110", "Food"));

        assertThat(rule.evaluate(records, TestDataFactory.createRuleContext(records))).isEmpty();
    }

    @Test
    void evaluate_categoryAbsentInCurrentMonth_skippedForLackOfIds() {
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(1L, "2024-05-01", "Landlord", "500", "Rent"),
                TestDataFactory.createExpense(2L, "2024-05-10", "KFC", "100", "Food"),
                TestDataFactory.createExpense(3L, "2024-06-10", "KFC", "100", "Food"));

        assertThat(rule.evaluate(records, TestDataFactory.createRuleContext(records))).isEmpty();
    }

    @Test
    void evaluate_comparesAdjacentMonthsPresentInData() {
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(1L, "2024-01-15", "Edhi", "1000", "Charity"),
                TestDataFactory.createExpense(2L, "2024-03-15", "Edhi", "300", "Charity"));

        List<RiskAlert> alerts = rule.evaluate(records, TestDataFactory.createRuleContext(records));

        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getTransactionIds()).containsExactly(2L);
    }

    @Test
    void evaluate_missingCategoryGroupedAsOther_undatedIgnored() {
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(1L, "2024-05-10", "Misc", "100", null),
                TestDataFactory.createExpense(2L, "2024-06-10", "Misc", "400", " "),
                TestDataFactory.createExpense(3L, "unknown", "Misc", "9999", null));

        List<RiskAlert> alerts = rule.evaluate(records, TestDataFactory.createRuleContext(records));

        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).getMessage()).contains("Other");
        assertThat(alerts.get(0).getTransactionIds()).containsExactly(2L);
    }
}
