package com.flagship.account_pro.observability;

import com.flagship.account_pro.account.AccountStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Metrics for account lifecycle operations.
 *
 * Metrics exposed:
 * - accounts.created / accounts.updated / accounts.deleted: lifecycle counters
 * - accounts.validation.failed: rejected submissions, tagged by operation
 * - accounts.count: gauge of accounts currently stored
 */
@Component
public class AccountMetrics {

    private final MeterRegistry registry;

    private final Counter accountsCreated;
    private final Counter accountsUpdated;
    private final Counter accountsDeleted;

    public AccountMetrics(MeterRegistry registry, AccountStore accountStore) {
        this.registry = registry;

        this.accountsCreated = Counter.builder("accounts.created")
                .description("Number of accounts created")
                .register(registry);

        this.accountsUpdated = Counter.builder("accounts.updated")
                .description("Number of accounts updated")
                .register(registry);

        this.accountsDeleted = Counter.builder("accounts.deleted")
                .description("Number of accounts deleted")
                .register(registry);

        registry.gauge("accounts.count", accountStore, AccountStore::count);
    }

    public void incrementAccountsCreated() {
        accountsCreated.increment();
    }

    public void incrementAccountsUpdated() {
        accountsUpdated.increment();
    }

    public void incrementAccountsDeleted() {
        accountsDeleted.increment();
    }

    /**
     * Records a rejected create or edit submission.
     */
    public void recordValidationFailure(String operation, int errorCount) {
        registry.counter("accounts.validation.failed", "operation", operation).increment();
        registry.summary("accounts.validation.errors", "operation", operation).record(errorCount);
    }
}
