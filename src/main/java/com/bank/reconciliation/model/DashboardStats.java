package com.bank.reconciliation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardStats {

    private int totalEntries;
    private int cleanEntries;
    private int flaggedEntries;
    private int duplicates;
    private BigDecimal totalIncome;
    private BigDecimal totalExpense;
    private Map<String, Integer> categoryBreakdown;

    // Keys: High (>= 0.8), Medium (>= 0.6), Low
    private Map<String, Integer> confidenceDistribution;
}
