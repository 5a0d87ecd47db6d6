package com.legacy.cobol.docs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CobolDocsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CobolDocsApplication.class, args);
    }
}
