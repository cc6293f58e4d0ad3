package com.flagship.account_pro.stats;

import com.flagship.account_pro.account.Account;
import com.flagship.account_pro.account.AccountStore;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Computes dashboard statistics. Nothing is cached; every call reads the
 * current store contents.
 */
@Service
public class AccountStatsService {

    private final AccountStore accountStore;

    public AccountStatsService(AccountStore accountStore) {
        this.accountStore = accountStore;
    }

    public AccountStats computeStats() {
        List<Account> accounts = accountStore.findAll();

        int total = accounts.size();
        int active = (int) accounts.stream().filter(Account::isActive).count();
        BigDecimal totalBalance = accounts.stream()
            .map(Account::getBalance)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(2, RoundingMode.HALF_UP);
        BigDecimal averageBalance = total > 0
            ? totalBalance.divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
            : BigDecimal.ZERO.setScale(2);

        return AccountStats.builder()
            .totalAccounts(total)
            .activeAccounts(active)
            .inactiveAccounts(total - active)
            .totalBalance(totalBalance)
            .averageBalance(averageBalance)
            .build();
    }
}
