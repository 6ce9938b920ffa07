package com.lernify.road;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LernifyRoadApplication {
    public static void main(String[] args) {
        SpringApplication.run(LernifyRoadApplication.class, args);
    }
}
