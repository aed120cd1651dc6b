package com.tapas.smartsales.olap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OlapServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OlapServiceApplication.class, args);
    }
}
