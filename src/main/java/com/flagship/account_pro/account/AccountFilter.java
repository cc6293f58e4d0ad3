package com.flagship.account_pro.account;

import lombok.Value;

/**
 * List filter. An absent field places no constraint.
 */
@Value
public class AccountFilter {
    AccountType accountType;
    AccountStatus status;

    public static AccountFilter none() {
        return new AccountFilter(null, null);
    }

    public static AccountFilter of(AccountType accountType, AccountStatus status) {
        return new AccountFilter(accountType, status);
    }

    public boolean matches(Account account) {
        return (accountType == null || accountType == account.getAccountType())
            && (status == null || status == account.getStatus());
    }
}
