package com.traceradar.analysis.gas;

public enum SuggestionType {
    GAS,
    PERFORMANCE
}
