package com.traceradar.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.traceradar.analysis.cache.AnalysisCache;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Caffeine-backed analysis cache and the clock used to timestamp analyses.
 */
@Configuration
@EnableConfigurationProperties(AnalysisProperties.class)
public class AnalysisCacheConfig {

    @Bean
    public Clock analysisClock() {
        return Clock.systemUTC();
    }

    @Bean
    public AnalysisCache analysisCache(AnalysisProperties properties, Clock analysisClock) {
        Duration ttl = properties.getCacheTtl() == null || properties.getCacheTtl().isNegative()
                ? Duration.ofMinutes(5)
                : properties.getCacheTtl();
        return new AnalysisCache(ttl, Ticker.systemTicker(), analysisClock);
    }
}
