package com.flagship.account_pro.validation;

import com.flagship.account_pro.account.AccountDetails;
import com.flagship.account_pro.account.AccountStatus;
import com.flagship.account_pro.account.AccountStore;
import com.flagship.account_pro.account.AccountType;
import com.flagship.account_pro.account.dto.AccountForm;
import com.flagship.account_pro.config.AccountProProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validates create and edit input.
 *
 * Every check runs and every failure is reported, in form order. The only
 * short-circuit is on email: format is not checked when it is empty, and
 * uniqueness is not checked when the format is wrong.
 */
@Component
public class AccountValidator {

    public static final BigDecimal MAX_BALANCE = new BigDecimal("1000000");

    static final String FIRST_NAME_REQUIRED = "First name is required";
    static final String LAST_NAME_REQUIRED = "Last name is required";
    static final String EMAIL_REQUIRED = "Email is required";
    static final String EMAIL_INVALID = "Invalid email format";
    static final String EMAIL_EXISTS = "Email already exists";
    static final String ACCOUNT_TYPE_REQUIRED = "Valid account type is required";
    static final String DEPARTMENT_REQUIRED = "Department is required";
    static final String STATUS_REQUIRED = "Valid status is required";
    static final String BALANCE_NEGATIVE = "Balance cannot be negative";
    static final String BALANCE_TOO_LARGE = "Balance too large";
    static final String BALANCE_INVALID = "Invalid balance format";

    private static final Pattern EMAIL_PATTERN =
        Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    private final AccountStore accountStore;
    private final BigDecimal maxBalance;

    public AccountValidator(AccountStore accountStore, AccountProProperties properties) {
        this.accountStore = accountStore;
        this.maxBalance = properties.getBalance().getMax();
    }

    public BigDecimal getMaxBalance() {
        return maxBalance;
    }

    public static boolean isValidEmail(String email) {
        return email != null && EMAIL_PATTERN.matcher(email).matches();
    }

    /**
     * Parses a balance and rounds it to cents (HALF_UP).
     * A missing value counts as zero; an empty one is a format error.
     */
    public static BalanceCheck validateBalance(String raw) {
        return validateBalance(raw, MAX_BALANCE);
    }

    /**
     * Same as {@link #validateBalance(String)} with an explicit upper bound.
     */
    public static BalanceCheck validateBalance(String raw, BigDecimal max) {
        String input = raw == null ? "0" : raw.strip();
        BigDecimal balance;
        try {
            balance = new BigDecimal(input);
        } catch (NumberFormatException | ArithmeticException e) {
            return BalanceCheck.rejected(BALANCE_INVALID);
        }
        if (balance.signum() < 0) {
            return BalanceCheck.rejected(BALANCE_NEGATIVE);
        }
        if (balance.compareTo(max) > 0) {
            return BalanceCheck.rejected(BALANCE_TOO_LARGE);
        }
        // below 0.001 always rounds to zero; rescaling a huge exponent would not terminate
        if (balance.signum() == 0 || balance.precision() - balance.scale() < -2) {
            return BalanceCheck.accepted(BigDecimal.ZERO.setScale(2));
        }
        return BalanceCheck.accepted(balance.setScale(2, RoundingMode.HALF_UP));
    }

    /**
     * Validates input for a new account. The status field is ignored;
     * new accounts are always ACTIVE.
     */
    public ValidationResult<AccountDetails> validateCreate(AccountForm form) {
        return validate(form, null);
    }

    /**
     * Validates input for editing {@code accountId}. The account's own email
     * does not count as a duplicate.
     */
    public ValidationResult<AccountDetails> validateEdit(long accountId, AccountForm form) {
        return validate(form, accountId);
    }

    private ValidationResult<AccountDetails> validate(AccountForm form, Long editedId) {
        boolean editing = editedId != null;
        List<String> errors = new ArrayList<>();

        String firstName = trim(form.getFirstName());
        String lastName = trim(form.getLastName());
        String email = trim(form.getEmail()).toLowerCase(Locale.ROOT);
        String department = trim(form.getDepartment());

        if (firstName.isEmpty()) {
            errors.add(FIRST_NAME_REQUIRED);
        }
        if (lastName.isEmpty()) {
            errors.add(LAST_NAME_REQUIRED);
        }
        if (email.isEmpty()) {
            errors.add(EMAIL_REQUIRED);
        } else if (!isValidEmail(email)) {
            errors.add(EMAIL_INVALID);
        } else if (accountStore.emailTaken(email, editedId)) {
            errors.add(EMAIL_EXISTS);
        }

        Optional<AccountType> accountType = AccountType.fromValue(form.getAccountType());
        if (accountType.isEmpty()) {
            errors.add(ACCOUNT_TYPE_REQUIRED);
        }
        if (department.isEmpty()) {
            errors.add(DEPARTMENT_REQUIRED);
        }

        Optional<AccountStatus> status = editing
            ? AccountStatus.fromValue(form.getStatus())
            : Optional.of(AccountStatus.ACTIVE);
        if (status.isEmpty()) {
            errors.add(STATUS_REQUIRED);
        }

        BalanceCheck balance = validateBalance(form.getBalance(), maxBalance);
        if (!balance.isAccepted()) {
            errors.add(balance.getError());
        }

        if (!errors.isEmpty()) {
            return ValidationResult.invalid(errors);
        }

        return ValidationResult.valid(AccountDetails.builder()
            .firstName(firstName)
            .lastName(lastName)
            .email(email)
            .accountType(accountType.get())
            .department(department)
            .status(status.get())
            .balance(balance.getValue())
            .build());
    }

    private static String trim(String value) {
        return value == null ? "" : value.strip();
    }
}
