package com.secureflow.ensemble;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EnsembleDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnsembleDetectionApplication.class, args);
    }
}
