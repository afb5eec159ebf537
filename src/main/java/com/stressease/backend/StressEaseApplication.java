package com.stressease.backend;

import com.stressease.backend.config.StressEaseProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(StressEaseProperties.class)
public class StressEaseApplication {
    public static void main(String[] args) {
        SpringApplication.run(StressEaseApplication.class, args);
    }
}
