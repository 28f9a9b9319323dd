package com.bank.reconciliation.model;

public enum TransactionType {
    INCOME,
    EXPENSE
}
