package com.carelog.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.carelog")
public class CareLogApplication {
    public static void main(String[] args) {
        SpringApplication.run(CareLogApplication.class, args);
    }
}
