package com.flagship.accounting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AccountingCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccountingCoreApplication.class, args);
    }
}
