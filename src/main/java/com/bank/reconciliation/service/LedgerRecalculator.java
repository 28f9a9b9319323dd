package com.bank.reconciliation.service;

import com.bank.reconciliation.model.Balance;
import com.bank.reconciliation.model.LedgerResult;
import com.bank.reconciliation.model.RunningBalance;
import com.bank.reconciliation.model.TransactionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Recomputes running balances and ledger totals from scratch.
 *
 * Records are walked in (date, id) order. Unparseable dates sort after every parseable one
 * and missing ids after present ones. The full recompute runs on every insert, update,
 * delete and opening-balance change; there is no incremental path.
 */
@Service
public class LedgerRecalculator {

    private static final Logger log = LoggerFactory.getLogger(LedgerRecalculator.class);

    private final DateNormalizer dateNormalizer;
    private final Clock clock;

    public LedgerRecalculator(DateNormalizer dateNormalizer, Clock clock) {
        this.dateNormalizer = dateNormalizer;
        this.clock = clock;
    }

    /**
     * Writes the post-transaction balance onto each record and returns the running balances
     * in chronological order together with the totals.
     *
     * @throws IllegalStateException if the walked balance disagrees with the totals
     */
    public LedgerResult recalculate(BigDecimal openingBalance, List<TransactionRecord> records) {
        BigDecimal opening = openingBalance != null ? openingBalance : BigDecimal.ZERO;
        List<TransactionRecord> ordered = chronological(records);

        BigDecimal running = opening;
        BigDecimal totalIncome = BigDecimal.ZERO;
        BigDecimal totalExpense = BigDecimal.ZERO;
        List<RunningBalance> balances = new ArrayList<>(ordered.size());

        for (TransactionRecord record : ordered) {
            BigDecimal income = orZero(record.getIncome());
            BigDecimal expense = orZero(record.getExpense());

            running = running.add(income).subtract(expense);
            totalIncome = totalIncome.add(income);
            totalExpense = totalExpense.add(expense);

            record.setRemainingBalance(running);
            balances.add(RunningBalance.builder()
                    .transactionId(record.getId())
                    .date(record.getDate())
                    .balance(running)
                    .build());
        }

        BigDecimal current = opening.add(totalIncome).subtract(totalExpense);
        if (current.compareTo(running) != 0) {
            throw new IllegalStateException(String.format(
                    "Ledger invariant violated: running balance %s != opening %s + income %s - expense %s",
                    running, opening, totalIncome, totalExpense));
        }

        log.debug("Recalculated ledger over {} record(s): opening={}, income={}, expense={}, current={}",
                ordered.size(), opening, totalIncome, totalExpense, current);

        return LedgerResult.builder()
                .runningBalances(balances)
                .balance(Balance.builder()
                        .openingBalance(opening)
                        .currentBalance(current)
                        .totalIncome(totalIncome)
                        .totalExpense(totalExpense)
                        .lastUpdated(clock.instant())
                        .build())
                .build();
    }

    /**
     * Returns a copy of the records sorted by (date, id).
     */
    public List<TransactionRecord> chronological(List<TransactionRecord> records) {
        List<TransactionRecord> ordered = records != null ? new ArrayList<>(records) : new ArrayList<>();
        ordered.sort(Comparator
                .comparing((TransactionRecord record) -> dateNormalizer.normalize(record.getDate()).orElse(LocalDate.MAX))
                .thenComparing(TransactionRecord::getId, Comparator.nullsLast(Comparator.naturalOrder())));
        return ordered;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
