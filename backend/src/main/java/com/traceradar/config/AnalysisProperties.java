package com.traceradar.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Analysis settings (traceradar.analysis.*).
 */
@ConfigurationProperties(prefix = "traceradar.analysis")
@Getter
@Setter
@NoArgsConstructor
public class AnalysisProperties {

    /** How long a completed analysis is served from the cache. */
    private Duration cacheTtl = Duration.ofMinutes(5);
}
