package com.z254.lumina.tutor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * TUTOR - adaptive multi-agent tutoring service of the LUMINA platform.
 *
 * <p>TUTOR provides:
 * <ul>
 *   <li>Message Bus - typed, routed messaging between specialist agents</li>
 *   <li>Orchestrator - staged execution plans with per-agent timeouts and graceful degradation</li>
 *   <li>Specialist Agents - conversation, content, visual, assessment, pedagogy and resources</li>
 *   <li>Adaptive Engine - Bayesian modality selection with fallback content generation</li>
 * </ul>
 *
 * <p>TUTOR integrates with the MCP service layer for AI providers, video search and analytics.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class TutorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TutorApplication.class, args);
    }
}
