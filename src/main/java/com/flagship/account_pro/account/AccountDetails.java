package com.flagship.account_pro.account;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * The mutable part of an account, already validated.
 *
 * Produced only by the validator; the store trusts it as-is.
 */
@Value
@Builder
public class AccountDetails {
    String firstName;
    String lastName;
    String email;
    AccountType accountType;
    String department;
    AccountStatus status;
    BigDecimal balance;
}
