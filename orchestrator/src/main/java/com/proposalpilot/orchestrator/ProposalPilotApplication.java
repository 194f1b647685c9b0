package com.proposalpilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Proposal pipeline service.
 *
 * To run:
 *   TAVILY_API_KEY=tvly-... mvn -pl orchestrator spring-boot:run
 *
 * Hugging Face and GitHub work unauthenticated (with lower rate limits);
 * set KAGGLE_API_TOKEN to add Kaggle as a dataset source.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class ProposalPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProposalPilotApplication.class, args);
    }
}
