package com.avf.riskengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AvfRiskEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AvfRiskEngineApplication.class, args);
    }
}
