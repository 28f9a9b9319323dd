package com.bank.reconciliation.service;

import com.bank.reconciliation.config.ConfidenceConfig;
import com.bank.reconciliation.model.ConfidenceAnalysis;
import com.bank.reconciliation.model.ConfidenceLevel;
import com.bank.reconciliation.model.ConfidenceVector;
import com.bank.reconciliation.model.TransactionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks a freshly extracted record for implausible values and weak extraction confidence.
 *
 * Every check runs; none short-circuits. Problems become flags or warnings rather than
 * errors, and any flag sends the record to human review.
 */
@Service
public class ConfidenceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceAnalyzer.class);

    private final ConfidenceConfig config;
    private final DateNormalizer dateNormalizer;
    private final Clock clock;

    public ConfidenceAnalyzer(ConfidenceConfig config, DateNormalizer dateNormalizer, Clock clock) {
        this.config = config;
        this.dateNormalizer = dateNormalizer;
        this.clock = clock;
    }

    public ConfidenceAnalysis analyze(TransactionRecord record) {
        Objects.requireNonNull(record, "record");

        List<String> flags = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        checkDate(record.getDate()).ifPresent(flags::add);

        BigDecimal amount = record.effectiveAmount();
        checkAmount(amount).ifPresent(flags::add);

        flags.addAll(checkVendor(record.getVendor()));

        ConfidenceVector confidence = record.getConfidence();
        double overall = 0.0;
        if (confidence != null) {
            for (Map.Entry<String, Double> field : confidence.asMap().entrySet()) {
                if (field.getValue() < config.getFieldWarningThreshold()) {
                    warnings.add(String.format("%s has low confidence (%.0f%%). Please review.",
                            capitalize(field.getKey()), field.getValue() * 100));
                }
            }
            overall = confidence.mean();
        }

        boolean needsReview = !flags.isEmpty()
                || overall < config.getReviewThreshold()
                || amount.signum() == 0;

        if (needsReview) {
            log.debug("Record {} ({}) needs review: flags={}, overallConfidence={}",
                    record.getId(), record.getVendor(), flags, overall);
        }

        return ConfidenceAnalysis.builder()
                .flags(flags)
                .warnings(warnings)
                .overallConfidence(overall)
                .level(ConfidenceLevel.fromScore(overall))
                .needsReview(needsReview)
                .build();
    }

    /**
     * Analyze the record and write the verdict onto its needs-review flag.
     */
    public TransactionRecord apply(TransactionRecord record) {
        ConfidenceAnalysis analysis = analyze(record);
        record.setNeedsReview(analysis.isNeedsReview());
        return record;
    }

    Optional<String> checkDate(String dateText) {
        if (dateText == null || dateText.isBlank()) {
            return Optional.of("Date is missing");
        }

        Optional<LocalDate> parsed = dateNormalizer.normalize(dateText);
        if (parsed.isEmpty()) {
            return Optional.of("Date format is invalid: '" + dateText.trim() + "'");
        }

        LocalDate today = LocalDate.now(clock);
        LocalDate date = parsed.get();
        if (date.isAfter(today)) {
            return Optional.of("Date is in the future. Please verify.");
        }
        if (ChronoUnit.DAYS.between(date, today) > config.getMaxDateAgeDays()) {
            return Optional.of(String.format("Date is more than %d days old. Please verify.",
                    config.getMaxDateAgeDays()));
        }
        return Optional.empty();
    }

    Optional<String> checkAmount(BigDecimal amount) {
        if (amount.signum() == 0) {
            return Optional.of("Amount is zero or missing");
        }
        if (amount.signum() < 0) {
            return Optional.of("Amount is negative");
        }
        if (amount.compareTo(config.getAmountCeiling()) > 0) {
            return Optional.of("Amount seems unusually high. Please verify.");
        }
        return Optional.empty();
    }

    List<String> checkVendor(String vendor) {
        List<String> flags = new ArrayList<>();
        if (vendor == null || vendor.isBlank() || vendor.trim().equalsIgnoreCase("unknown")) {
            flags.add("Vendor name is unknown or missing");
            return flags;
        }

        long special = vendor.chars()
                .filter(c -> !Character.isLetterOrDigit(c) && !Character.isWhitespace(c))
                .count();
        if (special > vendor.length() * config.getMaxVendorSpecialCharRatio()) {
            flags.add("Vendor name contains unusual characters. Extraction may have failed.");
        }
        if (vendor.length() > config.getMaxVendorLength()) {
            flags.add("Vendor name is unusually long. Please verify.");
        }
        return flags;
    }

    private static String capitalize(String field) {
        String label = field.replace('_', ' ');
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }
}
