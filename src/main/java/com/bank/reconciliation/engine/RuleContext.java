package com.bank.reconciliation.engine;

import com.bank.reconciliation.model.TransactionRecord;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Runtime context shared by every rule during one analysis pass.
 * Dates are normalized once per record up front.
 */
@Getter
@Builder
public class RuleContext {

    // "Today" for forward-looking rules
    private final LocalDate today;

    private final Map<TransactionRecord, LocalDate> parsedDates;

    public Optional<LocalDate> dateOf(TransactionRecord record) {
        return Optional.ofNullable(parsedDates.get(record));
    }

    public static RuleContext of(List<TransactionRecord> records,
                                 Function<String, Optional<LocalDate>> normalizer,
                                 LocalDate today) {
        Map<TransactionRecord, LocalDate> dates = new IdentityHashMap<>();
        for (TransactionRecord record : records) {
            normalizer.apply(record.getDate()).ifPresent(date -> dates.put(record, date));
        }
        return RuleContext.builder()
                .today(today)
                .parsedDates(dates)
                .build();
    }
}
