package com.supplyradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SupplyRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(SupplyRadarApplication.class, args);
    }
}
