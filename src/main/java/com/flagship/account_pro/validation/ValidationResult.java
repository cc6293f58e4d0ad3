package com.flagship.account_pro.validation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of validating user input: either the accepted value or the
 * ordered list of every failed check.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult<T> {
    T value;
    List<String> errors;

    public static <T> ValidationResult<T> valid(T value) {
        return new ValidationResult<>(value, List.of());
    }

    public static <T> ValidationResult<T> invalid(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one error");
        }
        return new ValidationResult<>(null, List.copyOf(errors));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }
}
