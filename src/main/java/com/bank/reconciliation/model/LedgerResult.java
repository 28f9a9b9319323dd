package com.bank.reconciliation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of a full ledger recalculation: running balances in chronological order plus totals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerResult {

    private List<RunningBalance> runningBalances;
    private Balance balance;
}
