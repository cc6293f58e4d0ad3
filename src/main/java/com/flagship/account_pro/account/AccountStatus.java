package com.flagship.account_pro.account;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Account status. New accounts always start ACTIVE; only an edit can
 * change it.
 */
public enum AccountStatus {
    ACTIVE("active"),
    INACTIVE("inactive");

    private final String value;

    AccountStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<AccountStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(status -> status.value.equals(value))
            .findFirst();
    }
}
