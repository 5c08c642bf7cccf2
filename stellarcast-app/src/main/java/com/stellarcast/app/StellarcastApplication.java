package com.stellarcast.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Stellarcast application entry point.
 */
@SpringBootApplication
@EnableScheduling
@ComponentScan(basePackages = "com.stellarcast")
public class StellarcastApplication {

    public static void main(String[] args) {
        SpringApplication.run(StellarcastApplication.class, args);
    }
}
