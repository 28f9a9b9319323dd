package com.bank.reconciliation.service;

import com.bank.reconciliation.model.DashboardStats;
import com.bank.reconciliation.model.TransactionRecord;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary statistics over a transaction snapshot for review and dashboard screens.
 */
@Service
public class DashboardService {

    private static final double HIGH_CONFIDENCE = 0.8;
    private static final double MEDIUM_CONFIDENCE = 0.6;

    public DashboardStats summarize(List<TransactionRecord> records) {
        Map<String, Integer> confidenceDistribution = new LinkedHashMap<>();
        confidenceDistribution.put("High", 0);
        confidenceDistribution.put("Medium", 0);
        confidenceDistribution.put("Low", 0);

        if (records == null || records.isEmpty()) {
            return DashboardStats.builder()
                    .totalEntries(0)
                    .cleanEntries(0)
                    .flaggedEntries(0)
                    .duplicates(0)
                    .totalIncome(BigDecimal.ZERO)
                    .totalExpense(BigDecimal.ZERO)
                    .categoryBreakdown(new TreeMap<>())
                    .confidenceDistribution(confidenceDistribution)
                    .build();
        }

        int flagged = 0;
        int duplicates = 0;
        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expense = BigDecimal.ZERO;
        Map<String, Integer> categories = new TreeMap<>();

        for (TransactionRecord record : records) {
            if (record.isNeedsReview()) flagged++;
            if (record.isDuplicate()) duplicates++;
            if (record.getIncome() != null) income = income.add(record.getIncome());
            if (record.getExpense() != null) expense = expense.add(record.getExpense());

            String category = record.getCategory() == null ? "Other" : record.getCategory();
            categories.merge(category, 1, Integer::sum);

            double confidence = record.getConfidence() != null ? record.getConfidence().mean() : 0.0;
            String bucket = confidence >= HIGH_CONFIDENCE ? "High"
                    : confidence >= MEDIUM_CONFIDENCE ? "Medium"
                    : "Low";
            confidenceDistribution.merge(bucket, 1, Integer::sum);
        }

        return DashboardStats.builder()
                .totalEntries(records.size())
                .cleanEntries(records.size() - flagged)
                .flaggedEntries(flagged)
                .duplicates(duplicates)
                .totalIncome(income)
                .totalExpense(expense)
                .categoryBreakdown(categories)
                .confidenceDistribution(confidenceDistribution)
                .build();
    }
}
