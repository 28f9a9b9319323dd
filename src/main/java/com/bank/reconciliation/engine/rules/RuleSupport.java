package com.bank.reconciliation.engine.rules;

import com.bank.reconciliation.model.TransactionRecord;
import com.bank.reconciliation.model.TransactionType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Small helpers shared by the risk rules.
 */
final class RuleSupport {

    private RuleSupport() {}

    static double amountOf(TransactionRecord record) {
        return record.effectiveAmount().doubleValue();
    }

    /**
     * Ledger effect of a record: income minus expense, or the raw amount signed by the
     * transaction type when the record has not been split yet.
     */
    static BigDecimal signedAmountOf(TransactionRecord record) {
        BigDecimal net = record.netAmount();
        if (net.signum() != 0 || record.getAmount() == null) {
            return net;
        }
        return record.getTransactionType() == TransactionType.INCOME
                ? record.getAmount()
                : record.getAmount().negate();
    }

    // Vendor grouping key, trimmed and case-folded
    static String vendorKey(TransactionRecord record) {
        return record.getVendor() == null ? "" : record.getVendor().trim().toLowerCase(Locale.ROOT);
    }

    static List<Long> idsOf(TransactionRecord record) {
        List<Long> ids = new ArrayList<>();
        if (record.getId() != null) {
            ids.add(record.getId());
        }
        return ids;
    }

    static List<Long> idsOf(Collection<TransactionRecord> records) {
        List<Long> ids = new ArrayList<>();
        records.stream()
                .map(TransactionRecord::getId)
                .filter(Objects::nonNull)
                .forEach(ids::add);
        return ids;
    }
}
