package com.bank.reconciliation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "reconciliation.risk")
public class RiskThresholdConfig {

    // Alert types (enum names) that the analyzer skips
    private List<String> disabledRules = new ArrayList<>();

    private RuleDefaults ruleDefaults = new RuleDefaults();

    @Data
    public static class RuleDefaults {
        private double duplicateThreshold = 90.0;
        private double largeTransactionMultiplier = 2.0;
        private double lowConfidenceCutoff = 0.9;
        private double categoryChangePct = 25.0;
        private int subscriptionMinOccurrences = 3;
        private double subscriptionMinIntervalDays = 25.0;
        private double subscriptionMaxIntervalDays = 35.0;
        private int depletionHorizonDays = 90;
        private double firstTimeVendorMultiplier = 1.5;
        private double weekendSpikeMultiplier = 1.5;
        private double taxDeductibleMinAmount = 100.0;
        private List<String> taxDeductibleCategories =
                new ArrayList<>(List.of("business", "medical", "charity", "education", "home_office", "office"));
    }
}
