package com.edge.metrics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdgeMetricsApplication {

    public static void main(String[] args) {
        SpringApplication.run(EdgeMetricsApplication.class, args);
    }
}
