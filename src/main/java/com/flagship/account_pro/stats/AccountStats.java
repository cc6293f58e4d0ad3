package com.flagship.account_pro.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Dashboard statistics over all stored accounts.
 */
@Value
@Builder
public class AccountStats {

    @JsonProperty("total_accounts")
    int totalAccounts;

    @JsonProperty("active_accounts")
    int activeAccounts;

    @JsonProperty("inactive_accounts")
    int inactiveAccounts;

    @JsonProperty("total_balance")
    BigDecimal totalBalance;

    @JsonProperty("average_balance")
    BigDecimal averageBalance;
}
