package com.flagship.account_pro.account;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Service tier of an account.
 *
 * The lower-case {@link #value()} is the wire format used by forms,
 * query parameters and JSON.
 */
public enum AccountType {
    BASIC("basic"),
    STANDARD("standard"),
    PREMIUM("premium");

    private final String value;

    AccountType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Exact, case-sensitive lookup by wire value.
     */
    public static Optional<AccountType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.value.equals(value))
            .findFirst();
    }
}
