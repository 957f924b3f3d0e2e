package com.carepilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * CarePilot orchestrator.
 *
 * To run:
 *   GROQ_API_KEY=gsk_... VISION_ENDPOINT=http://localhost:9000/classify mvn spring-boot:run
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
