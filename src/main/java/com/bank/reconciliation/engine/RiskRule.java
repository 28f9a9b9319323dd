package com.bank.reconciliation.engine;

import com.bank.reconciliation.model.AlertType;
import com.bank.reconciliation.model.RiskAlert;
import com.bank.reconciliation.model.TransactionRecord;

import java.util.List;

/**
 * Interface for all risk detection rules.
 * Each implementation produces alerts of a single AlertType.
 */
public interface RiskRule {

    /**
     * The alert type this rule produces.
     */
    AlertType getAlertType();

    /**
     * Evaluate the full transaction snapshot.
     *
     * @param records the snapshot; implementations must not modify it or its records
     * @param context per-analysis data shared by all rules (today's date, parsed dates)
     * @return zero or more alerts
     */
    List<RiskAlert> evaluate(List<TransactionRecord> records, RuleContext context);
}
