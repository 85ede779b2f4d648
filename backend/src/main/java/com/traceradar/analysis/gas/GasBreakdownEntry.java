package com.traceradar.analysis.gas;

import com.traceradar.domain.FunctionCategory;

public record GasBreakdownEntry(FunctionCategory category, long gasUsed, double percentage) {
}
