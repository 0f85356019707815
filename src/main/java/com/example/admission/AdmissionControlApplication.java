package com.example.admission;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AdmissionControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdmissionControlApplication.class, args);
    }
}
