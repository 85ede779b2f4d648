package com.traceradar.analysis.gas;

public record ContractGasUsage(String address, String contractName, long gasUsed, int callCount, double percentage) {
}
