package com.dococr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DocOcrApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocOcrApplication.class, args);
    }
}
