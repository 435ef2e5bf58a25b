package com.eventedge.hypepipe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HypePipeApplication {

    public static void main(String[] args) {
        SpringApplication.run(HypePipeApplication.class, args);
    }
}
