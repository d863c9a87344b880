package com.backlinkqc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BacklinkQcApplication {

    public static void main(String[] args) {
        SpringApplication.run(BacklinkQcApplication.class, args);
    }
}
