package com.traceradar.analysis.security;

import com.traceradar.domain.RiskLevel;

import java.math.BigInteger;

public record ApprovalRisk(
        String spender,
        BigInteger amount,
        String formattedAmount,
        boolean infinite,
        RiskLevel level,
        String description,
        String recommendation
) {
}
