package com.example.admission;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot Application Main Class
 */
@EnableScheduling
@ConfigurationPropertiesScan
@SpringBootApplication
public class AdmissionControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdmissionControlApplication.class, args);
    }
}
