package com.bank.reconciliation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAlert {

    private Severity severity;

    private AlertType type;

    private String message;

    // Empty for forward-looking projections
    @Builder.Default
    private List<Long> transactionIds = new ArrayList<>();

    private String recommendedAction;
}
