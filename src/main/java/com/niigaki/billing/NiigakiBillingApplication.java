package com.niigaki.billing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class NiigakiBillingApplication {

    public static void main(String[] args) {
        SpringApplication.run(NiigakiBillingApplication.class, args);
    }
}
