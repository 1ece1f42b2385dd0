package com.usdtgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UsdtGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(UsdtGateApplication.class, args);
    }
}
