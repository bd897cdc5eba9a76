package com.oceanintel.argo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class ArgoIngesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArgoIngesterApplication.class, args);
    }
}
