package com.flagship.account_pro.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Account domain object.
 *
 * Key principles:
 * - id and createdDate are fixed at creation
 * - edits produce a new Account carrying the same id and createdDate
 * - new accounts always start ACTIVE
 */
@Value
public class Account {
    long id;
    String firstName;
    String lastName;
    String email;
    AccountType accountType;
    String department;
    AccountStatus status;
    LocalDate createdDate;
    BigDecimal balance;

    /**
     * Creates a new ACTIVE account. Any status carried by the details is ignored.
     */
    public static Account create(long id, AccountDetails details, LocalDate createdDate) {
        return new Account(
            id,
            details.getFirstName(),
            details.getLastName(),
            details.getEmail(),
            details.getAccountType(),
            details.getDepartment(),
            AccountStatus.ACTIVE,
            createdDate,
            details.getBalance()
        );
    }

    /**
     * Replaces every mutable field.
     *
     * @return New Account with the same id and createdDate
     */
    public Account withDetails(AccountDetails details) {
        return new Account(
            this.id,
            details.getFirstName(),
            details.getLastName(),
            details.getEmail(),
            details.getAccountType(),
            details.getDepartment(),
            details.getStatus(),
            this.createdDate,
            details.getBalance()
        );
    }

    public String getFullName() {
        return firstName + " " + lastName;
    }

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }
}
