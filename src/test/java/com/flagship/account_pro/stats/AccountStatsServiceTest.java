package com.flagship.account_pro.stats;

import com.flagship.account_pro.account.Account;
import com.flagship.account_pro.account.AccountStatus;
import com.flagship.account_pro.account.AccountStore;
import com.flagship.account_pro.account.AccountType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccountStatsServiceTest {

    private static Account account(long id, String balance, AccountStatus status) {
        return new Account(id, "First" + id, "Last" + id, id + "@example.com", AccountType.BASIC,
            "Dept", status, LocalDate.of(2024, 1, (int) id), new BigDecimal(balance));
    }

    @Test
    @DisplayName("Stats over the demo accounts")
    void testComputeStats() {
        AccountStore store = new AccountStore(List.of(
            account(1, "15750.00", AccountStatus.ACTIVE),
            account(2, "8250.00", AccountStatus.ACTIVE),
            account(3, "2100.00", AccountStatus.INACTIVE)
        ), Clock.systemUTC());

        AccountStats stats = new AccountStatsService(store).computeStats();

        assertEquals(3, stats.getTotalAccounts());
        assertEquals(2, stats.getActiveAccounts());
        assertEquals(1, stats.getInactiveAccounts());
        assertEquals(new BigDecimal("26100.00"), stats.getTotalBalance());
        assertEquals(new BigDecimal("8700.00"), stats.getAverageBalance());
    }

    @Test
    @DisplayName("Empty store averages to zero")
    void testComputeStats_Empty() {
        AccountStats stats = new AccountStatsService(new AccountStore(Clock.systemUTC())).computeStats();

        assertEquals(0, stats.getTotalAccounts());
        assertEquals(0, stats.getActiveAccounts());
        assertEquals(0, stats.getInactiveAccounts());
        assertEquals(0, BigDecimal.ZERO.compareTo(stats.getTotalBalance()));
        assertEquals(0, BigDecimal.ZERO.compareTo(stats.getAverageBalance()));
    }

    @Test
    @DisplayName("Stats follow store changes; nothing is cached")
    void testComputeStats_Recomputed() {
        AccountStore store = new AccountStore(List.of(
            account(1, "10.00", AccountStatus.ACTIVE),
            account(2, "20.00", AccountStatus.INACTIVE)
        ), Clock.systemUTC());
        AccountStatsService service = new AccountStatsService(store);

        assertEquals(new BigDecimal("15.00"), service.computeStats().getAverageBalance());

        store.delete(2);
        AccountStats stats = service.computeStats();
        assertEquals(1, stats.getTotalAccounts());
        assertEquals(0, stats.getInactiveAccounts());
        assertEquals(new BigDecimal("10.00"), stats.getAverageBalance());
    }

    @Test
    @DisplayName("Average is rounded half-up to cents")
    void testComputeStats_AverageRounding() {
        AccountStore store = new AccountStore(List.of(
            account(1, "10.00", AccountStatus.ACTIVE),
            account(2, "10.00", AccountStatus.ACTIVE),
            account(3, "0.01", AccountStatus.ACTIVE)
        ), Clock.systemUTC());

        AccountStats stats = new AccountStatsService(store).computeStats();

        assertEquals(new BigDecimal("20.01"), stats.getTotalBalance());
        assertEquals(new BigDecimal("6.67"), stats.getAverageBalance());
    }
}
