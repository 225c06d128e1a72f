package com.seedfund.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SeedFundTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SeedFundTrackerApplication.class, args);
    }
}
