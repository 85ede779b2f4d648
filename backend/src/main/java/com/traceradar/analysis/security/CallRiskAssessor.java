package com.traceradar.analysis.security;

import com.traceradar.domain.FunctionParameters;
import com.traceradar.domain.RiskLevel;
import com.traceradar.domain.TokenProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scores a single call from its function name and decoded arguments.
 * Score bands: 90+ critical, 70+ high, 40+ medium, otherwise low.
 */
@Component
@RequiredArgsConstructor
public class CallRiskAssessor {

    private final TokenProfile tokenProfile;

    public RiskAssessment assess(String functionName, FunctionParameters parameters) {
        String name = functionName == null ? "" : functionName;
        FunctionParameters params = parameters == null ? FunctionParameters.empty() : parameters;
        int score = 0;
        List<String> factors = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        Optional<RiskLevel> tableLevel = SecurityRiskTable.lookup(name);
        if (tableLevel.isPresent()) {
            switch (tableLevel.get()) {
                case CRITICAL -> {
                    score = 100;
                    factors.add("Critical system function");
                    recommendations.add("Immediate review required");
                }
                case HIGH -> {
                    score = 80;
                    factors.add("High-privilege operation");
                    recommendations.add("Verify authorization");
                }
                case MEDIUM -> {
                    score = 50;
                    factors.add("Administrative function");
                    recommendations.add("Monitor for unusual activity");
                }
                default -> {
                    score = 20;
                    factors.add("Standard operation");
                }
            }
        }

        BigInteger amount = params.amount();
        if (name.contains("transfer") && amount != null
                && amount.compareTo(ApprovalThresholds.large(tokenProfile.decimals())) > 0) {
            score += 20;
            factors.add("Large transfer amount");
            recommendations.add("Verify transfer legitimacy");
        }

        if (name.contains("approve")) {
            score += 10;
            factors.add("Approval operation");
            recommendations.add("Review approval amount and spender");
            if (ApprovalThresholds.isInfinite(amount)) {
                score += 60;
                factors.add("Unlimited approval amount");
                recommendations.add("Use exact approval amounts");
            }
        }

        return new RiskAssessment(levelFor(score), score, factors, recommendations);
    }

    static RiskLevel levelFor(int score) {
        if (score >= 90) {
            return RiskLevel.CRITICAL;
        }
        if (score >= 70) {
            return RiskLevel.HIGH;
        }
        if (score >= 40) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
