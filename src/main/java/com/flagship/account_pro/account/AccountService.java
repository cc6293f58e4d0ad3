package com.flagship.account_pro.account;

import com.flagship.account_pro.account.dto.AccountForm;
import com.flagship.account_pro.observability.AccountMetrics;
import com.flagship.account_pro.observability.CorrelationContext;
import com.flagship.account_pro.validation.AccountValidator;
import com.flagship.account_pro.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Account use cases on top of the store.
 *
 * Create and edit run validation and mutation inside one store transaction,
 * so an email accepted as unique is still unique when it is written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountStore accountStore;
    private final AccountValidator accountValidator;
    private final AccountMetrics accountMetrics;

    /**
     * Lists accounts using raw query values. A blank value means "any";
     * a value that names no type or status matches nothing.
     */
    public List<Account> listAccounts(String accountType, String status) {
        AccountType typeFilter = null;
        AccountStatus statusFilter = null;

        if (accountType != null && !accountType.isEmpty()) {
            Optional<AccountType> parsed = AccountType.fromValue(accountType);
            if (parsed.isEmpty()) {
                return List.of();
            }
            typeFilter = parsed.get();
        }
        if (status != null && !status.isEmpty()) {
            Optional<AccountStatus> parsed = AccountStatus.fromValue(status);
            if (parsed.isEmpty()) {
                return List.of();
            }
            statusFilter = parsed.get();
        }

        return accountStore.list(AccountFilter.of(typeFilter, statusFilter));
    }

    public List<Account> listAccounts() {
        return accountStore.findAll();
    }

    /**
     * Most recently created accounts first; accounts created the same day
     * keep their insertion order.
     */
    public List<Account> recentAccounts(int limit) {
        return accountStore.findAll().stream()
            .sorted(Comparator.comparing(Account::getCreatedDate).reversed())
            .limit(limit)
            .toList();
    }

    /**
     * @throws AccountNotFoundException if no account has this id
     */
    public Account getAccount(long id) {
        return accountStore.findById(id)
            .orElseThrow(() -> new AccountNotFoundException(id));
    }

    public Optional<Account> findAccount(long id) {
        return accountStore.findById(id);
    }

    public int countAccounts() {
        return accountStore.count();
    }

    /**
     * Validates the form and, if it passes, stores a new ACTIVE account.
     *
     * @return the created account, or every validation error
     */
    public ValidationResult<Account> createAccount(AccountForm form) {
        ValidationResult<Account> result = accountStore.inTransaction(() -> {
            ValidationResult<AccountDetails> validation = accountValidator.validateCreate(form);
            if (!validation.isValid()) {
                return ValidationResult.<Account>invalid(validation.getErrors());
            }
            return ValidationResult.valid(accountStore.create(validation.getValue()));
        });

        if (!result.isValid()) {
            accountMetrics.recordValidationFailure("create", result.getErrors().size());
            log.debug("Account creation rejected: errors={}", result.getErrors());
            return result;
        }

        Account account = result.getValue();
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(account.getId()));
        accountMetrics.incrementAccountsCreated();
        log.info("Account created: type={}, department={}",
                account.getAccountType().value(), account.getDepartment());
        return result;
    }

    /**
     * Validates the form and, if it passes, replaces the account's mutable fields.
     *
     * @return the updated account, or every validation error
     * @throws AccountNotFoundException if no account has this id
     */
    public ValidationResult<Account> updateAccount(long id, AccountForm form) {
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(id));

        ValidationResult<Account> result = accountStore.inTransaction(() -> {
            if (accountStore.findById(id).isEmpty()) {
                throw new AccountNotFoundException(id);
            }
            ValidationResult<AccountDetails> validation = accountValidator.validateEdit(id, form);
            if (!validation.isValid()) {
                return ValidationResult.<Account>invalid(validation.getErrors());
            }
            Account updated = accountStore.update(id, validation.getValue())
                .orElseThrow(() -> new AccountNotFoundException(id));
            return ValidationResult.valid(updated);
        });

        if (!result.isValid()) {
            accountMetrics.recordValidationFailure("edit", result.getErrors().size());
            log.debug("Account update rejected: errors={}", result.getErrors());
            return result;
        }

        accountMetrics.incrementAccountsUpdated();
        log.info("Account updated: status={}", result.getValue().getStatus().value());
        return result;
    }

    /**
     * Removes an account. Its id is never handed out again; its email becomes free.
     *
     * @return the removed account
     * @throws AccountNotFoundException if no account has this id
     */
    public Account deleteAccount(long id) {
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(id));

        Account removed = accountStore.delete(id)
            .orElseThrow(() -> new AccountNotFoundException(id));

        accountMetrics.incrementAccountsDeleted();
        log.info("Account deleted");
        return removed;
    }
}
