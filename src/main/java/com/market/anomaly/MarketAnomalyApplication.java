package com.market.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketAnomalyApplication.class, args);
    }
}
