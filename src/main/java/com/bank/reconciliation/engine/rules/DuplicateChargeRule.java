package com.bank.reconciliation.engine.rules;

import com.bank.reconciliation.config.RiskThresholdConfig;
import com.bank.reconciliation.engine.RiskRule;
import com.bank.reconciliation.engine.RuleContext;
import com.bank.reconciliation.model.AlertType;
import com.bank.reconciliation.model.DuplicateMatch;
import com.bank.reconciliation.model.RiskAlert;
import com.bank.reconciliation.model.Severity;
import com.bank.reconciliation.model.TransactionRecord;
import com.bank.reconciliation.service.DuplicateDetector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Flags clusters of near-identical charges.
 *
 * Uses the duplicate detector at a stricter threshold than ingestion does (90 by default).
 * Every record in a reported cluster is marked processed, by identity so that records without
 * an id count too, and the same cluster is reported once.
 */
@Component
public class DuplicateChargeRule implements RiskRule {

    private final DuplicateDetector duplicateDetector;
    private final RiskThresholdConfig config;

    public DuplicateChargeRule(DuplicateDetector duplicateDetector, RiskThresholdConfig config) {
        this.duplicateDetector = duplicateDetector;
        this.config = config;
    }

    @Override
    public AlertType getAlertType() {
        return AlertType.DUPLICATE_CHARGES;
    }

    @Override
    public List<RiskAlert> evaluate(List<TransactionRecord> records, RuleContext context) {
        double threshold = config.getRuleDefaults().getDuplicateThreshold();
        List<RiskAlert> alerts = new ArrayList<>();
        Set<TransactionRecord> processed = Collections.newSetFromMap(new IdentityHashMap<>());

        for (TransactionRecord record : records) {
            if (processed.contains(record)) {
                continue;
            }

            List<DuplicateMatch> matches = duplicateDetector.findDuplicates(record, records, threshold);
            if (matches.isEmpty()) {
                continue;
            }

            List<Long> ids = new ArrayList<>();
            matches.stream()
                    .map(DuplicateMatch::getMatchedId)
                    .filter(Objects::nonNull)
                    .forEach(ids::add);
            if (record.getId() != null) {
                ids.add(record.getId());
            }

            alerts.add(RiskAlert.builder()
                    .severity(Severity.MEDIUM)
                    .type(AlertType.DUPLICATE_CHARGES)
                    .message(String.format("Potential duplicate transactions detected for %s with amount %s",
                            record.getVendor(), record.effectiveAmount().toPlainString()))
                    .transactionIds(ids)
                    .recommendedAction("Review and merge duplicate transactions")
                    .build());
            processed.add(record);
            matches.forEach(match -> processed.add(match.getMatchedRecord()));
        }
        return alerts;
    }
}
