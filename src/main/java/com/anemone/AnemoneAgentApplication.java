package com.anemone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AnemoneAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnemoneAgentApplication.class, args);
    }
}
