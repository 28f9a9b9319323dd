package com.bank.reconciliation.engine;

import com.bank.reconciliation.config.MetricsConfig;
import com.bank.reconciliation.config.RiskThresholdConfig;
import com.bank.reconciliation.model.AlertType;
import com.bank.reconciliation.model.RiskAlert;
import com.bank.reconciliation.model.RiskAnalysisResult;
import com.bank.reconciliation.model.Severity;
import com.bank.reconciliation.model.TransactionRecord;
import com.bank.reconciliation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RiskAnalyzerTest {

    @Mock private RiskRule largeTransactionRule;
    @Mock private RiskRule taxDeductibleRule;
    @Mock private MetricsConfig metricsConfig;

    private RiskThresholdConfig config;
    private RiskAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        when(largeTransactionRule.getAlertType()).thenReturn(AlertType.UNUSUALLY_LARGE_TRANSACTION);
        when(taxDeductibleRule.getAlertType()).thenReturn(AlertType.POTENTIAL_TAX_DEDUCTIBLE);
        config = new RiskThresholdConfig();
        analyzer = new RiskAnalyzer(List.of(taxDeductibleRule, largeTransactionRule), config,
                TestDataFactory.createDateNormalizer(), metricsConfig, TestDataFactory.fixedClock());
    }

    private static RiskAlert alert(AlertType type, Severity severity, Long id) {
        return RiskAlert.builder()
                .type(type)
                .severity(severity)
                .message(type.getCode())
                .transactionIds(List.of(id))
                .build();
    }

    @Test
    void analyze_emptySnapshot_noAlertsWithoutRunningRules() {
        RiskAnalysisResult result = analyzer.analyze(List.of());

        assertThat(result.isNoAlerts()).isTrue();
        assertThat(result.getAlerts()).isEmpty();
        assertThat(result.getAnalyzedAt()).isEqualTo(Instant.parse("2024-06-15T10:00:00Z"));
        verify(largeTransactionRule, never()).evaluate(anyList(), any());
        verify(metricsConfig).recordAnalysis(0);
    }

    @Test
    void analyze_concatenatesAlertsInAlertTypeOrder() {
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(1L, "2024-06-01", "KFC", "500", "Business"));
        when(largeTransactionRule.evaluate(anyList(), any()))
                .thenReturn(List.of(alert(AlertType.UNUSUALLY_LARGE_TRANSACTION, Severity.HIGH, 1L)));
        when(taxDeductibleRule.evaluate(anyList(), any()))
                .thenReturn(List.of(alert(AlertType.POTENTIAL_TAX_DEDUCTIBLE, Severity.LOW, 1L)));

        RiskAnalysisResult result = analyzer.analyze(records);

        assertThat(result.isNoAlerts()).isFalse();
        assertThat(result.getAlerts()).extracting(RiskAlert::getType).containsExactly(
                AlertType.UNUSUALLY_LARGE_TRANSACTION, AlertType.POTENTIAL_TAX_DEDUCTIBLE);
        verify(metricsConfig).recordAnalysis(1);
        verify(metricsConfig).recordAlert("unusually_large_transaction");
        verify(metricsConfig).recordAlert("potential_tax_deductible");
    }

    @Test
    void analyze_failingRuleDoesNotBlockOthers() {
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(1L, "2024-06-01", "KFC", "500"));
        when(largeTransactionRule.evaluate(anyList(), any())).thenThrow(new IllegalStateException("boom"));
        when(taxDeductibleRule.evaluate(anyList(), any()))
                .thenReturn(List.of(alert(AlertType.POTENTIAL_TAX_DEDUCTIBLE, Severity.LOW, 1L)));

        RiskAnalysisResult result = analyzer.analyze(records);

        assertThat(result.getAlerts()).extracting(RiskAlert::getType)
                .containsExactly(AlertType.POTENTIAL_TAX_DEDUCTIBLE);
    }

    @Test
    void analyze_disabledRuleIsSkipped() {
        config.setDisabledRules(List.of("UNUSUALLY_LARGE_TRANSACTION"));
        List<TransactionRecord> records = List.of(
                TestDataFactory.createExpense(1L, "2024-06-01", "KFC", "500"));
        when(taxDeductibleRule.evaluate(anyList(), any())).thenReturn(List.of());

        RiskAnalysisResult result = analyzer.analyze(records);

        assertThat(result.isNoAlerts()).isTrue();
        verify(largeTransactionRule, never()).evaluate(anyList(), any());
        verify(metricsConfig, never()).recordAlert(any());
    }

    @Test
    void analyze_contextCarriesTodayAndParsedDates() {
        TransactionRecord dated = TestDataFactory.createExpense(1L, "01/06/2024", "KFC", "500");
        TransactionRecord undated = TestDataFactory.createExpense(2L, "n/a", "KFC", "500");
        when(largeTransactionRule.evaluate(anyList(), any())).thenAnswer(invocation -> {
            RuleContext context = invocation.getArgument(1);
            assertThat(context.getToday()).isEqualTo(LocalDate.of(2024, 6, 15));
            assertThat(context.dateOf(dated)).contains(LocalDate.of(2024, 6, 1));
            assertThat(context.dateOf(undated)).isEmpty();
            return List.of();
        });
        when(taxDeductibleRule.evaluate(anyList(), any())).thenReturn(List.of());

        analyzer.analyze(List.of(dated, undated));

        verify(largeTransactionRule, times(1)).evaluate(anyList(), any());
    }

    @Test
    void getRegisteredRules_returnsAlertTypesInEnumOrder() {
        assertThat(analyzer.getRegisteredRules()).containsExactly(
                AlertType.UNUSUALLY_LARGE_TRANSACTION, AlertType.POTENTIAL_TAX_DEDUCTIBLE);
    }
}
