package com.bank.reconciliation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * A single bookkeeping transaction as extracted from a source document or entered manually.
 *
 * Income and expense are kept as separate non-negative columns. A freshly extracted
 * candidate may instead carry a single raw {@code amount} that has not been split yet.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRecord {

    // Null until the record store assigns one
    private Long id;

    // Caller-supplied text, normalized on demand
    private String date;

    private String vendor;

    @Builder.Default
    private BigDecimal income = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal expense = BigDecimal.ZERO;

    // Raw single amount from field extraction, before the income/expense split
    private BigDecimal amount;

    @Builder.Default
    private TransactionType transactionType = TransactionType.EXPENSE;

    @Builder.Default
    private String currency = "PKR";

    private String category;

    private String notes;

    private ConfidenceVector confidence;

    private boolean duplicate;

    private Long duplicateOf;

    private boolean needsReview;

    // Post-transaction ledger balance, written by the ledger recalculation only
    private BigDecimal remainingBalance;

    private String sourceFile;

    private String rawText;

    /**
     * The representative magnitude of this record: income, then expense, then the raw
     * amount, whichever is first present and non-zero.
     */
    public Optional<BigDecimal> magnitude() {
        if (isNonZero(income)) return Optional.of(income);
        if (isNonZero(expense)) return Optional.of(expense);
        if (isNonZero(amount)) return Optional.of(amount);
        return Optional.empty();
    }

    public BigDecimal effectiveAmount() {
        return magnitude().orElse(BigDecimal.ZERO);
    }

    /**
     * Signed ledger effect of this record.
     */
    public BigDecimal netAmount() {
        return nullToZero(income).subtract(nullToZero(expense));
    }

    private static boolean isNonZero(BigDecimal value) {
        return value != null && value.signum() != 0;
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
