package com.portfoliobacktest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PortfolioBacktestApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioBacktestApplication.class, args);
    }
}
