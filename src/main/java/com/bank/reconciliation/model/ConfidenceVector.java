package com.bank.reconciliation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-field extraction confidence, each value in [0.0, 1.0].
 * {@code transactionType} is optional and only counted when present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfidenceVector {

    private double vendor;
    private double amount;
    private double date;
    private double category;
    private Double transactionType;

    /**
     * Returns the present entries keyed by field name, in a stable order.
     */
    public Map<String, Double> asMap() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("vendor", vendor);
        values.put("amount", amount);
        values.put("date", date);
        values.put("category", category);
        if (transactionType != null) {
            values.put("transaction_type", transactionType);
        }
        return values;
    }

    public double mean() {
        Map<String, Double> values = asMap();
        return values.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    public static ConfidenceVector uniform(double value) {
        return ConfidenceVector.builder()
                .vendor(value)
                .amount(value)
                .date(value)
                .category(value)
                .build();
    }
}
