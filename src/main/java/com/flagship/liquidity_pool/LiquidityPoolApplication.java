package com.flagship.liquidity_pool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiquidityPoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiquidityPoolApplication.class, args);
    }
}
