package com.bank.reconciliation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Category to keyword table used for auto-categorization. Keywords may mix English and
 * transliterated Urdu for the same concept. Map order breaks exact scoring ties.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "reconciliation.categories")
public class CategoryConfig {

    private String fallbackCategory = "Other";

    private double fallbackConfidence = 0.3;

    private Map<String, List<String>> keywords = defaultKeywords();

    private static Map<String, List<String>> defaultKeywords() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("Food", List.of("kfc", "mcdonald", "restaurant", "cafe", "food", "burger", "pizza",
                "khana", "dhaba", "hotel"));
        table.put("Fuel", List.of("pso", "shell", "total", "petrol", "fuel", "gas", "diesel"));
        table.put("Transport", List.of("uber", "careem", "taxi", "transport", "bus", "metro", "rickshaw"));
        table.put("Utilities", List.of("electricity", "gas", "water", "internet", "phone", "bill",
                "bijli", "paani", "wapda", "sui gas"));
        table.put("Rent", List.of("rent", "lease", "housing", "kiraya"));
        table.put("Office", List.of("stationery", "office", "supplies", "printer"));
        table.put("Medical", List.of("pharmacy", "hospital", "clinic", "medical", "doctor", "dawai"));
        table.put("Education", List.of("school", "tuition", "university", "college", "books", "fees"));
        table.put("Charity", List.of("donation", "charity", "zakat", "sadqa", "edhi"));
        table.put("Business", List.of("invoice", "consulting", "client", "vendor payment", "wholesale"));
        table.put("Other", List.of());
        return table;
    }
}
