package com.taxitelemetry.fare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FareServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(FareServiceApplication.class, args);
    }
}
