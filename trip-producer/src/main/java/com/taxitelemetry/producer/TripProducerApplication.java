package com.taxitelemetry.producer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TripProducerApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TripProducerApplication.class, args)));
    }
}
