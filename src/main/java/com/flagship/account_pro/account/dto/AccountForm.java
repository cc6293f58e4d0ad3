package com.flagship.account_pro.account.dto;

import com.flagship.account_pro.account.Account;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw create/edit input as submitted by the account form.
 *
 * Every field is optional text; nothing here is trusted until
 * the validator has turned it into AccountDetails.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountForm {
    private String firstName;
    private String lastName;
    private String email;
    private String accountType;
    private String department;
    private String status;
    private String balance;

    /**
     * Pre-fills the edit form from a stored account.
     */
    public static AccountForm from(Account account) {
        return AccountForm.builder()
            .firstName(account.getFirstName())
            .lastName(account.getLastName())
            .email(account.getEmail())
            .accountType(account.getAccountType().value())
            .department(account.getDepartment())
            .status(account.getStatus().value())
            .balance(account.getBalance().toPlainString())
            .build();
    }
}
