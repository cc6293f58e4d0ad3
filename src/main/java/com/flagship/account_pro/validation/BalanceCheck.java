package com.flagship.account_pro.validation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of parsing a balance: a value or a single error message.
 */
@Value
public class BalanceCheck {
    BigDecimal value;
    String error;

    static BalanceCheck accepted(BigDecimal value) {
        return new BalanceCheck(value, null);
    }

    static BalanceCheck rejected(String error) {
        return new BalanceCheck(null, error);
    }

    public boolean isAccepted() {
        return error == null;
    }
}
