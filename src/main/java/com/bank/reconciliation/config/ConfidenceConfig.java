package com.bank.reconciliation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

@Data
@Configuration
@ConfigurationProperties(prefix = "reconciliation.confidence")
public class ConfidenceConfig {

    // Mean confidence below which a record needs review
    private double reviewThreshold = 0.7;

    // Per-field confidence below which a warning is emitted
    private double fieldWarningThreshold = 0.5;

    private long maxDateAgeDays = 730;

    private BigDecimal amountCeiling = new BigDecimal("1000000");

    private double maxVendorSpecialCharRatio = 0.3;

    private int maxVendorLength = 50;
}
