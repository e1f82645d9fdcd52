package com.hydromat.tooling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HydromatToolingApplication {

    public static void main(String[] args) {
        SpringApplication.run(HydromatToolingApplication.class, args);
    }
}
