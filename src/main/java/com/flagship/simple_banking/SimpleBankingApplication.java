package com.flagship.simple_banking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SimpleBankingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SimpleBankingApplication.class, args);
    }
}
