package com.flagship.property_settlement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PropertySettlementApplication {

    public static void main(String[] args) {
        SpringApplication.run(PropertySettlementApplication.class, args);
    }
}
