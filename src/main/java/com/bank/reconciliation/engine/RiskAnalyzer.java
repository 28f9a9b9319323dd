package com.bank.reconciliation.engine;

import com.bank.reconciliation.config.MetricsConfig;
import com.bank.reconciliation.config.RiskThresholdConfig;
import com.bank.reconciliation.model.AlertType;
import com.bank.reconciliation.model.RiskAlert;
import com.bank.reconciliation.model.RiskAnalysisResult;
import com.bank.reconciliation.model.TransactionRecord;
import com.bank.reconciliation.service.DateNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every registered risk rule over the same transaction snapshot and concatenates
 * their alerts. Uses the Strategy pattern: each AlertType is produced by one RiskRule bean.
 * Alerts are computed fresh on every call and never deduplicated across rules.
 */
@Component
public class RiskAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RiskAnalyzer.class);

    private final Map<AlertType, RiskRule> ruleMap;
    private final RiskThresholdConfig config;
    private final DateNormalizer dateNormalizer;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public RiskAnalyzer(List<RiskRule> rules, RiskThresholdConfig config, DateNormalizer dateNormalizer,
                        MetricsConfig metricsConfig, Clock clock) {
        this.ruleMap = new EnumMap<>(AlertType.class);
        this.config = config;
        this.dateNormalizer = dateNormalizer;
        this.metricsConfig = metricsConfig;
        this.clock = clock;

        // Auto-register all rule implementations
        for (RiskRule rule : rules) {
            ruleMap.put(rule.getAlertType(), rule);
            log.info("Registered risk rule: {} -> {}",
                    rule.getAlertType(), rule.getClass().getSimpleName());
        }

        for (String disabled : config.getDisabledRules()) {
            boolean known = ruleMap.keySet().stream().anyMatch(type -> type.name().equals(disabled));
            if (!known) {
                log.warn("Disabled risk rule '{}' does not match any registered rule", disabled);
            }
        }
    }

    /**
     * Evaluate all enabled rules against the given snapshot.
     *
     * @param records the full transaction set; not modified
     * @return the merged alerts, with {@code noAlerts} set when nothing was found
     */
    public RiskAnalysisResult analyze(List<TransactionRecord> records) {
        List<TransactionRecord> snapshot = records != null
                ? Collections.unmodifiableList(new ArrayList<>(records))
                : List.of();
        metricsConfig.recordAnalysis(snapshot.size());

        if (snapshot.isEmpty()) {
            return RiskAnalysisResult.builder()
                    .alerts(new ArrayList<>())
                    .noAlerts(true)
                    .analyzedAt(clock.instant())
                    .build();
        }

        RuleContext context = RuleContext.of(snapshot, dateNormalizer::normalize, LocalDate.now(clock));
        List<RiskAlert> alerts = new ArrayList<>();

        for (Map.Entry<AlertType, RiskRule> entry : ruleMap.entrySet()) {
            AlertType type = entry.getKey();
            if (config.getDisabledRules().contains(type.name())) {
                log.debug("Risk rule {} is disabled, skipping", type);
                continue;
            }

            try {
                List<RiskAlert> produced = entry.getValue().evaluate(snapshot, context);
                produced.forEach(alert -> metricsConfig.recordAlert(type.getCode()));
                if (!produced.isEmpty()) {
                    log.debug("Risk rule {} produced {} alert(s) over {} record(s)",
                            type, produced.size(), snapshot.size());
                }
                alerts.addAll(produced);
            } catch (RuntimeException e) {
                // One failing rule must not block the remaining ones
                log.error("Error evaluating risk rule {} over {} record(s): {}",
                        type, snapshot.size(), e.getMessage(), e);
            }
        }

        return RiskAnalysisResult.builder()
                .alerts(alerts)
                .noAlerts(alerts.isEmpty())
                .analyzedAt(clock.instant())
                .build();
    }

    public List<AlertType> getRegisteredRules() {
        return new ArrayList<>(ruleMap.keySet());
    }
}
