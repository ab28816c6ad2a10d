package com.ai.salescaller;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SalesCallerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesCallerApplication.class, args);
    }
}
