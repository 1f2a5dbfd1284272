package com.liquidityledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiquidityLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiquidityLedgerApplication.class, args);
    }
}
