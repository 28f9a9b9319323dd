package com.bank.reconciliation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "reconciliation.duplicates")
public class DuplicateDetectionConfig {

    // Minimum overall similarity (0-100) for a match to be reported
    private double threshold = 70.0;

    private Weights weights = new Weights();

    @Data
    public static class Weights {
        private double amount = 0.40;
        private double vendor = 0.40;
        private double date = 0.15;
        private double category = 0.05;
    }
}
