package com.example.cardamageanalyzer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Provides the HTTP client used to reach the damage scoring service. Timeouts come from
 * {@code analyzer.scoring.*}; a timed out call surfaces as a transport failure for that image.
 */
@Configuration
public class ScoringClientConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ScoringClientConfiguration.class);

    @Bean
    public RestTemplate scoringRestTemplate(RestTemplateBuilder builder, AnalyzerProperties properties) {
        AnalyzerProperties.Scoring scoring = properties.getScoring();
        log.info("Scoring service endpoint: {} (connect timeout {}, read timeout {})",
                scoring.getUrl(), scoring.getConnectTimeout(), scoring.getReadTimeout());
        return builder
                .setConnectTimeout(scoring.getConnectTimeout())
                .setReadTimeout(scoring.getReadTimeout())
                .build();
    }
}
