package com.bank.reconciliation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Ledger totals. {@code currentBalance} always equals
 * {@code openingBalance + totalIncome - totalExpense}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Balance {

    private BigDecimal openingBalance;
    private BigDecimal currentBalance;
    private BigDecimal totalIncome;
    private BigDecimal totalExpense;
    private Instant lastUpdated;
}
