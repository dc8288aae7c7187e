package com.validatorpayments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ValidatorPaymentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ValidatorPaymentsApplication.class, args);
    }
}
