package com.z254.lumina.tutor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for TUTOR service.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI tutorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("TUTOR API")
                        .description("""
                                TUTOR - Adaptive Multi-Agent Tutoring for the LUMINA platform.

                                Answers student questions by coordinating specialist agents and adapts
                                the presentation modality to each learner.

                                ## Features
                                - **Query Orchestration**: staged agent plans with graceful degradation
                                - **Specialist Agents**: explanations, visuals, practice, study paths, resources
                                - **Adaptive Engine**: Bayesian modality preferences with fallback generation
                                - **Learner Analytics**: beliefs, confidence intervals and learning patterns
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("LUMINA Engineering")))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8090").description("Local development")
                ));
    }
}
