package com.civic.transparency.validation;

import java.util.Objects;

/**
 * One failed check.
 *
 * @param field schema path of the offending field in snake_case, e.g. {@code acct_type} or
 *     {@code points[2].coordination_signals.burst_score}
 * @param kind what went wrong
 * @param message human-readable description, as rendered in the joined error text
 */
public record Violation(String field, ViolationKind kind, String message) {

    public Violation {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return message;
    }
}
