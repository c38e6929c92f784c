package com.example.KbRag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class KbRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(KbRagApplication.class, args);
    }
}
