package com.bank.reconciliation.model;

/**
 * Identifiers of the risk rules. Each rule produces alerts of exactly one type.
 */
public enum AlertType {
    DUPLICATE_CHARGES("duplicate_charges"),
    UNUSUALLY_LARGE_TRANSACTION("unusually_large_transaction"),
    LOW_CONFIDENCE_FIELDS("low_confidence_fields"),
    SUDDEN_CATEGORY_CHANGE("sudden_category_change"),
    SUBSCRIPTION_DETECTED("subscription_detected"),
    PROJECTED_BALANCE_RISK("projected_balance_risk"),
    FIRST_TIME_HIGH_VALUE_VENDOR("first_time_high_value_vendor"),
    WEEKEND_SPENDING_SPIKE("weekend_spending_spike"),
    POTENTIAL_TAX_DEDUCTIBLE("potential_tax_deductible");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
