package com.bank.reconciliation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategorySuggestion {

    private String category;
    private double confidence;
    private String reasoning;
    private List<String> matchedKeywords;
    private List<String> alternativeCategories;
}
