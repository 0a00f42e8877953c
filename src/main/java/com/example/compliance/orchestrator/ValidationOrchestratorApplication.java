package com.example.compliance.orchestrator;

import com.example.compliance.orchestrator.config.OrchestratorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(OrchestratorProperties.class)
public class ValidationOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ValidationOrchestratorApplication.class, args);
    }

}
