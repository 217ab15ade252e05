package com.leakgate.model;

import lombok.Value;

import java.util.List;

@Value
public class Classification {
    Category category;
    double confidence;
    List<String> reasons;

    public Classification(Category category, double confidence, List<String> reasons) {
        this.category = category;
        this.confidence = confidence;
        this.reasons = List.copyOf(reasons);
    }

    public static Classification unknown(List<String> reasons) {
        return new Classification(Category.UNKNOWN, 0.1, reasons);
    }

    public static Classification error(String message) {
        return unknown(List.of("classification_error:" + message));
    }
}
