package com.civic.transparency.validation;

import java.util.List;

/**
 * Thrown when a record that must be valid is not.
 * <p>
 * A RuntimeException: callers that escalate treat invalid input as a programming error. The
 * message is the {@code "; "}-joined text of every violation; {@link #violations()} exposes the
 * individual failures.
 */
public class ValidationException extends RuntimeException {

    private final List<Violation> violations;

    public ValidationException(List<Violation> violations) {
        super(ValidationErrors.join(violations));
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("ValidationException requires at least one violation");
        }
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }

    public boolean hasViolation(String field) {
        return ValidationErrors.anyField(violations, field);
    }

    public boolean hasViolation(ViolationKind kind) {
        return ValidationErrors.anyKind(violations, kind);
    }
}
