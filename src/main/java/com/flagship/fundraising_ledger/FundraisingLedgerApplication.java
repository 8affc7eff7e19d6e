package com.flagship.fundraising_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FundraisingLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FundraisingLedgerApplication.class, args);
    }
}
