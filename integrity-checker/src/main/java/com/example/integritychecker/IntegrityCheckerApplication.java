package com.example.integritychecker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IntegrityCheckerApplication {

    public static void main(String[] args) {
        SpringApplication.run(IntegrityCheckerApplication.class, args);
    }
}
