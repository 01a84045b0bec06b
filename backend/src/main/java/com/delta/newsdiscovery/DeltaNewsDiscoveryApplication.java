package com.delta.newsdiscovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeltaNewsDiscoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeltaNewsDiscoveryApplication.class, args);
    }
}
