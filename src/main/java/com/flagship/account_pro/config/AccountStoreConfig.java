package com.flagship.account_pro.config;

import com.flagship.account_pro.account.Account;
import com.flagship.account_pro.account.AccountStatus;
import com.flagship.account_pro.account.AccountStore;
import com.flagship.account_pro.account.AccountType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Wires the process-wide account store.
 *
 * The store starts with three demo accounts unless
 * {@code accountpro.seed.enabled=false}.
 */
@Configuration
@Slf4j
public class AccountStoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public AccountStore accountStore(AccountProProperties properties, Clock clock) {
        List<Account> seed = properties.getSeed().isEnabled() ? seedAccounts() : List.of();
        log.info("Initializing account store: seededAccounts={}", seed.size());
        return new AccountStore(seed, clock);
    }

    static List<Account> seedAccounts() {
        return List.of(
            new Account(1, "John", "Doe", "john.doe@example.com", AccountType.PREMIUM,
                "Sales", AccountStatus.ACTIVE, LocalDate.of(2024, 1, 15), new BigDecimal("15750.00")),
            new Account(2, "Sarah", "Johnson", "sarah.j@example.com", AccountType.STANDARD,
                "Marketing", AccountStatus.ACTIVE, LocalDate.of(2024, 2, 20), new BigDecimal("8250.00")),
            new Account(3, "Mike", "Chen", "mike.chen@example.com", AccountType.BASIC,
                "Support", AccountStatus.INACTIVE, LocalDate.of(2024, 3, 10), new BigDecimal("2100.00"))
        );
    }
}
