package com.traceradar.analysis.security;

import com.traceradar.common.TokenAmounts;
import com.traceradar.domain.GasThresholds;
import com.traceradar.domain.KnownFunctions;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.RiskLevel;
import com.traceradar.domain.TokenProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-call security rules, approval grading and the ordering anti-pattern scan.
 */
@Component
@RequiredArgsConstructor
public class SecurityAnalyzer {

    private final TokenProfile tokenProfile;
    private final CallRiskAssessor riskAssessor;

    public SecurityAssessment assess(List<ProcessedCallNode> nodes) {
        if (nodes.isEmpty()) {
            return SecurityAssessment.empty();
        }
        List<SecurityConcern> concerns = detectConcerns(nodes);
        List<ApprovalRisk> approvalRisks = gradeApprovals(nodes);
        List<HighRiskOperation> operations = highRiskOperations(nodes);

        long critical = concerns.stream().filter(c -> c.level() == RiskLevel.CRITICAL).count();
        long high = concerns.stream().filter(c -> c.level() == RiskLevel.HIGH).count();
        long medium = concerns.stream().filter(c -> c.level() == RiskLevel.MEDIUM).count();
        RiskLevel overall = RiskLevel.LOW;
        if (critical > 0) {
            overall = RiskLevel.CRITICAL;
        } else if (high > 0) {
            overall = RiskLevel.HIGH;
        } else if (medium > 2 || !operations.isEmpty()) {
            overall = RiskLevel.MEDIUM;
        }

        long errors = nodes.stream().filter(ProcessedCallNode::hasError).count();
        return new SecurityAssessment(overall, concerns, operations,
                recommendations(critical, approvalRisks, operations, errors, concerns), approvalRisks);
    }

    List<SecurityConcern> detectConcerns(List<ProcessedCallNode> nodes) {
        List<SecurityConcern> concerns = new ArrayList<>();
        BigInteger large = ApprovalThresholds.large(tokenProfile.decimals());
        for (ProcessedCallNode node : nodes) {
            String name = node.functionName() == null ? "" : node.functionName();

            SecurityRiskTable.lookup(name).ifPresent(level ->
                    concerns.add(concern(level, "High-risk function '" + name + "' called", node)));

            BigInteger amount = node.parameters().amount();
            if (KnownFunctions.APPROVE.equals(name) && amount != null && amount.signum() > 0) {
                if (ApprovalThresholds.isInfinite(amount)) {
                    concerns.add(concern(RiskLevel.MEDIUM, "Potentially infinite approval granted", node));
                } else if (amount.compareTo(large) >= 0) {
                    concerns.add(concern(RiskLevel.LOW, "Large approval granted: " + formatted(amount), node));
                }
            }

            if (name.toLowerCase().contains(KnownFunctions.SELFDESTRUCT)) {
                concerns.add(concern(RiskLevel.CRITICAL, "Contract self-destruct called", node));
            }
            if (KnownFunctions.TRANSFER_OWNERSHIP.equals(name)) {
                concerns.add(concern(RiskLevel.HIGH, "Contract ownership transfer detected", node));
            }
            if (KnownFunctions.PAUSE.equals(name)) {
                concerns.add(concern(RiskLevel.MEDIUM, "Contract paused", node));
            } else if (KnownFunctions.UNPAUSE.equals(name)) {
                concerns.add(concern(RiskLevel.MEDIUM, "Contract unpaused", node));
            }
            if (node.hasError()) {
                concerns.add(concern(RiskLevel.MEDIUM, "Transaction failed: " + node.error(), node));
            }
        }
        return concerns;
    }

    List<ApprovalRisk> gradeApprovals(List<ProcessedCallNode> nodes) {
        BigInteger large = ApprovalThresholds.large(tokenProfile.decimals());
        BigInteger moderate = ApprovalThresholds.moderate(tokenProfile.decimals());
        List<ApprovalRisk> risks = new ArrayList<>();
        for (ProcessedCallNode node : nodes) {
            BigInteger amount = node.parameters().amount();
            if (!KnownFunctions.APPROVE.equals(node.functionName()) || amount == null || amount.signum() <= 0) {
                continue;
            }
            String spender = node.parameters().spender() == null ? "Unknown" : node.parameters().spender();
            String display = formatted(amount);
            boolean infinite = ApprovalThresholds.isInfinite(amount);
            if (infinite) {
                risks.add(new ApprovalRisk(spender, amount, display, true, RiskLevel.HIGH,
                        "Infinite approval granted - allows unlimited spending",
                        "Consider using exact approval amounts instead of infinite approvals"));
            } else if (amount.compareTo(large) >= 0) {
                risks.add(new ApprovalRisk(spender, amount, display, false, RiskLevel.MEDIUM,
                        "Large approval amount: " + display,
                        "Verify the approval amount is appropriate for intended use"));
            } else if (amount.compareTo(moderate) >= 0) {
                risks.add(new ApprovalRisk(spender, amount, display, false, RiskLevel.LOW,
                        "Moderate approval amount: " + display,
                        "Monitor spender activity for unusual patterns"));
            } else {
                risks.add(new ApprovalRisk(spender, amount, display, false, RiskLevel.LOW, "", ""));
            }
        }
        return risks;
    }

    List<HighRiskOperation> highRiskOperations(List<ProcessedCallNode> nodes) {
        List<HighRiskOperation> operations = new ArrayList<>();
        for (ProcessedCallNode node : nodes) {
            RiskAssessment assessment = riskAssessor.assess(node.functionName(), node.parameters());
            if (assessment.level().isAtLeast(RiskLevel.HIGH)) {
                operations.add(new HighRiskOperation(node.functionName(), assessment.level(),
                        String.join(", ", assessment.factors()), node.contractName(), node.from()));
            }
        }
        return operations;
    }

    /**
     * Ordering and ratio scan, independent of the concern rules.
     */
    public AntiPatternReport scanAntiPatterns(List<ProcessedCallNode> nodes) {
        List<String> patterns = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        RiskLevel severity = RiskLevel.LOW;

        for (int i = 0; i < nodes.size() - 1; i++) {
            ProcessedCallNode current = nodes.get(i);
            ProcessedCallNode next = nodes.get(i + 1);
            if (!current.tracked() && "CALL".equals(current.callType())
                    && next.tracked() && next.functionNameContains("transfer")) {
                patterns.add("Potential reentrancy pattern detected");
                recommendations.add("Review call order and implement reentrancy guards");
                severity = RiskLevel.MEDIUM;
                break;
            }
        }

        long approvals = nodes.stream().filter(n -> KnownFunctions.APPROVE.equals(n.functionName())).count();
        long transfers = nodes.stream().filter(n -> n.functionNameContains("transfer")).count();
        if (approvals > transfers && approvals > 2) {
            patterns.add("Unusual approval-to-transfer ratio");
            recommendations.add("Review approval strategy and consider batching");
            severity = RiskLevel.max(severity, RiskLevel.MEDIUM);
        }

        if (nodes.stream().anyMatch(n -> n.gasUsed() > GasThresholds.HIGH)) {
            patterns.add("High gas usage operations detected");
            recommendations.add("Optimize gas usage to prevent out-of-gas failures");
        }
        return new AntiPatternReport(patterns, severity, recommendations);
    }

    private static List<SecurityRecommendation> recommendations(long critical, List<ApprovalRisk> approvalRisks,
                                                                List<HighRiskOperation> operations, long errors,
                                                                List<SecurityConcern> concerns) {
        List<SecurityRecommendation> out = new ArrayList<>();
        if (critical > 0) {
            out.add(new SecurityRecommendation("immediate_action",
                    "Critical security issues detected - immediate review required", RiskLevel.HIGH));
        }
        if (approvalRisks.stream().anyMatch(r -> r.level() == RiskLevel.HIGH)) {
            out.add(new SecurityRecommendation("approval_review",
                    "Review infinite approvals and consider using exact amounts", RiskLevel.MEDIUM));
        }
        if (!operations.isEmpty()) {
            out.add(new SecurityRecommendation("privilege_review",
                    "High-privilege operations detected - verify authorization", RiskLevel.MEDIUM));
        }
        if (errors > 0) {
            out.add(new SecurityRecommendation("error_investigation",
                    errors + " failed operations detected - investigate causes", RiskLevel.LOW));
        }
        if (concerns.isEmpty() && operations.isEmpty()) {
            out.add(new SecurityRecommendation("monitoring",
                    "No immediate security concerns - continue monitoring", RiskLevel.LOW));
        }
        return out;
    }

    private static SecurityConcern concern(RiskLevel level, String description, ProcessedCallNode node) {
        return new SecurityConcern(level, description, node.contractName(), node.from());
    }

    private String formatted(BigInteger amount) {
        return TokenAmounts.format(TokenAmounts.scale(amount, tokenProfile.decimals())) + " " + tokenProfile.symbol();
    }
}
