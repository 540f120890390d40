package com.advisoryplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdvisoryOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdvisoryOrchestratorApplication.class, args);
    }
}
