package com.bank.reconciliation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered date patterns tried by the date normalizer. The first pattern that parses wins,
 * so the order decides how ambiguous day/month inputs are read.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "reconciliation.dates")
public class DateFormatConfig {

    private List<String> patterns = new ArrayList<>(List.of(
            "uuuu-M-d",
            "uuuu-M-d H:mm[:ss]",
            "d/M/uuuu",
            "M/d/uuuu",
            "uuuu/M/d",
            "d-M-uuuu",
            "d.M.uuuu",
            "uuuu.M.d",
            "uuuuMMdd",
            "MMMM d, uuuu",
            "d MMMM uuuu",
            "MMM d, uuuu",
            "d MMM uuuu"));
}
