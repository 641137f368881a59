package com.parley.feedmodel;

import java.util.List;

/**
 * Result of validating a feed record before it is written.
 *
 * @param valid true if validation passed with no errors
 * @param errors list of human-readable error messages (empty when valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    /** Convenience factory for a successful validation. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Convenience factory for a failed validation. */
    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }

    /** Joins all errors into a single message, e.g. for an exception detail. */
    public String describe() {
        return String.join("; ", errors);
    }
}
