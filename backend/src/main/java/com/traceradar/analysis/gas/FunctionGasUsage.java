package com.traceradar.analysis.gas;

/**
 * Gas spent per function name; efficiency grades the average call.
 */
public record FunctionGasUsage(String functionName, long gasUsed, int callCount, double percentage, GasEfficiency efficiency) {
}
