package com.herzen.metrics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MetricEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(MetricEngineApplication.class, args);
    }
}
