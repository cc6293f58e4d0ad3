package com.flagship.account_pro.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.account_pro.account.Account;
import com.flagship.account_pro.account.AccountStatus;
import com.flagship.account_pro.account.AccountType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * JSON view of an account.
 */
@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("first_name")
    String firstName;

    @JsonProperty("last_name")
    String lastName;

    @JsonProperty("email")
    String email;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("department")
    String department;

    @JsonProperty("status")
    AccountStatus status;

    @JsonProperty("created_date")
    LocalDate createdDate;

    @JsonProperty("balance")
    BigDecimal balance;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .firstName(account.getFirstName())
            .lastName(account.getLastName())
            .email(account.getEmail())
            .accountType(account.getAccountType())
            .department(account.getDepartment())
            .status(account.getStatus())
            .createdDate(account.getCreatedDate())
            .balance(account.getBalance())
            .build();
    }
}
