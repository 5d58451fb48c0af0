package com.sealedstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SealedStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(SealedStoreApplication.class, args);
    }
}
