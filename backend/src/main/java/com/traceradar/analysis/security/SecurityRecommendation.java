package com.traceradar.analysis.security;

import com.traceradar.domain.RiskLevel;

public record SecurityRecommendation(String type, String description, RiskLevel severity) {
}
