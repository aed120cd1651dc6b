package com.tapas.smartsales.etl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EtlServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(EtlServiceApplication.class, args);
    }
}
