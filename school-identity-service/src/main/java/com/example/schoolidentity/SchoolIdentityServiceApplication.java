package com.example.schoolidentity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SchoolIdentityServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchoolIdentityServiceApplication.class, args);
    }
}
