package com.flagship.account_pro.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.account_pro.account.dto.AccountResponse;
import com.flagship.account_pro.stats.AccountStats;
import lombok.Value;

import java.util.List;

/**
 * Response envelopes of the JSON API. Every body carries a {@code success} flag.
 */
public final class ApiResponses {

    private ApiResponses() {
    }

    @Value
    public static class AccountList {
        @JsonProperty("success")
        boolean success;

        @JsonProperty("count")
        int count;

        @JsonProperty("accounts")
        List<AccountResponse> accounts;
    }

    @Value
    public static class SingleAccount {
        @JsonProperty("success")
        boolean success;

        @JsonProperty("account")
        AccountResponse account;
    }

    @Value
    public static class Stats {
        @JsonProperty("success")
        boolean success;

        @JsonProperty("stats")
        AccountStats stats;
    }

    @Value
    public static class Failure {
        @JsonProperty("success")
        boolean success;

        @JsonProperty("message")
        String message;
    }
}
