package com.traceradar.analysis.gas;

public record GasDistributionEntry(String category, long gasUsed, int callCount, double percentage) {
}
