package com.okrcoach.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoachingOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoachingOrchestratorApplication.class, args);
    }
}
