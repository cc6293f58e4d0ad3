package com.flagship.account_pro.account;

import lombok.Getter;

/**
 * Raised when an operation references an account id that does not exist.
 */
@Getter
public class AccountNotFoundException extends RuntimeException {

    private final long accountId;

    public AccountNotFoundException(long accountId) {
        super("Account not found: " + accountId);
        this.accountId = accountId;
    }
}
