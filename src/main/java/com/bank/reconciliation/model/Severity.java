package com.bank.reconciliation.model;

/**
 * Coarse triage priority of a risk alert.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
