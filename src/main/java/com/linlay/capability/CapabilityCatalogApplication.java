package com.linlay.capability;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CapabilityCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(CapabilityCatalogApplication.class, args);
    }
}
