package com.flagship.ledger_reports;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LedgerReportsApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerReportsApplication.class, args);
    }
}
