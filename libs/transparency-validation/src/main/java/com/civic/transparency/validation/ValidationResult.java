package com.civic.transparency.validation;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of validating a record.
 * <p>
 * Carries the same violations two ways: as structured {@link Violation}s for programmatic
 * checks and as joined text through {@link #message()} for display.
 *
 * @param valid      true if no check failed
 * @param violations every failed check, in the order the checks ran (empty when valid)
 */
public record ValidationResult(boolean valid, List<Violation> violations) {

    private static final ValidationResult OK = new ValidationResult(true, List.of());

    public ValidationResult {
        violations = List.copyOf(violations);
        if (valid != violations.isEmpty()) {
            throw new IllegalArgumentException(
                    "valid=%s inconsistent with %d violation(s)".formatted(valid, violations.size()));
        }
    }

    /** Result of a clean pass. */
    public static ValidationResult ok() {
        return OK;
    }

    /** Creates a failing result with one or more violations. */
    public static ValidationResult fail(List<Violation> violations) {
        return new ValidationResult(false, violations);
    }

    /** Violation messages joined by {@code "; "}; empty when valid. */
    public String message() {
        return ValidationErrors.join(violations);
    }

    /** Whether any violation concerns exactly the given field path. */
    public boolean hasViolation(String field) {
        return ValidationErrors.anyField(violations, field);
    }

    /** Whether any violation is of the given kind. */
    public boolean hasViolation(ViolationKind kind) {
        return ValidationErrors.anyKind(violations, kind);
    }

    /**
     * Returns the failure as an exception, or empty when valid.
     */
    public Optional<ValidationException> error() {
        return valid ? Optional.empty() : Optional.of(new ValidationException(violations));
    }

    /**
     * Throws when the result is not valid.
     *
     * @throws ValidationException carrying every violation
     */
    public void orThrow() {
        if (!valid) {
            throw new ValidationException(violations);
        }
    }
}
