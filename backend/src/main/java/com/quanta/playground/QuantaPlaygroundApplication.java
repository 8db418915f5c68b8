package com.quanta.playground;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class QuantaPlaygroundApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuantaPlaygroundApplication.class, args);
    }
}
