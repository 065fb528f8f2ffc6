package com.wom.openings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OpeningsApplication {

    public static void main(String[] args) {
        SpringApplication.run(OpeningsApplication.class, args);
    }
}
