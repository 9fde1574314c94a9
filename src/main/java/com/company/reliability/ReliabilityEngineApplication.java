package com.company.reliability;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@OpenAPIDefinition(
        info = @Info(
                title = "Reliability Engine API",
                version = "1.0.0",
                description = "SLO error budgets, burn alerts, deployment gating and drift analysis"
        )
)
public class ReliabilityEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReliabilityEngineApplication.class, args);
    }
}
