package com.pshcalculator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PshCalculatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PshCalculatorApplication.class, args);
    }
}
