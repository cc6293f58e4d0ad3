package com.flagship.account_pro;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AccountProApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccountProApplication.class, args);
    }
}
