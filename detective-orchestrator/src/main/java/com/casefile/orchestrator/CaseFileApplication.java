package com.casefile.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CaseFileApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaseFileApplication.class, args);
    }
}
