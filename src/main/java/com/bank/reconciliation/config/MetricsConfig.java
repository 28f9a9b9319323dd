package com.bank.reconciliation.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAlert(String alertType) {
        Counter.builder("risk.alert.count")
                .tag("alert_type", alertType)
                .register(registry)
                .increment();
    }

    public void recordAnalysis(int recordCount) {
        DistributionSummary.builder("risk.analysis.records")
                .register(registry)
                .record(recordCount);
    }

    public void recordDuplicateDetected() {
        Counter.builder("duplicate.detected.count")
                .register(registry)
                .increment();
    }

    public void recordReviewFlagged() {
        Counter.builder("review.flagged.count")
                .register(registry)
                .increment();
    }
}
