package com.finops.costengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CostAnomalyEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostAnomalyEngineApplication.class, args);
    }
}
