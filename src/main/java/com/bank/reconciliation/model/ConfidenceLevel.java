package com.bank.reconciliation.model;

public enum ConfidenceLevel {
    VERY_LOW,
    LOW,
    MEDIUM,
    HIGH;

    public static ConfidenceLevel fromScore(double score) {
        if (score >= 0.9) return HIGH;
        if (score >= 0.7) return MEDIUM;
        if (score >= 0.5) return LOW;
        return VERY_LOW;
    }
}
