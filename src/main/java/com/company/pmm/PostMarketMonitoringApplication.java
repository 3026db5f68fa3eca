package com.company.pmm;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableAsync
@OpenAPIDefinition(
        info = @Info(
                title = "Post-Market Monitoring API",
                version = "1.0.0",
                description = "Post-market monitoring of deployed AI systems: metrics, alerts, signals, "
                        + "complaints, SLA and EU AI Act Article 72 reporting"
        )
)
public class PostMarketMonitoringApplication {

    public static void main(String[] args) {
        SpringApplication.run(PostMarketMonitoringApplication.class, args);
    }
}
