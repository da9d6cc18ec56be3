package com.flagship.custody_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CustodyLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CustodyLedgerApplication.class, args);
    }
}
