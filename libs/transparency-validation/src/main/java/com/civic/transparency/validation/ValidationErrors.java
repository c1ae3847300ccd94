package com.civic.transparency.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects every {@link Violation} found during one validation pass.
 *
 * <p>Validators append to their own instance and finish with {@link #toResult()}, so a record is
 * always reported in full rather than stopping at the first problem.
 *
 * <p>Not thread-safe. An instance belongs to a single validation call and is discarded once its
 * result has been produced.
 */
public final class ValidationErrors {

    static final String SEPARATOR = "; ";

    private final List<Violation> violations = new ArrayList<>();

    /**
     * Records a violation, keeping append order. Null is ignored.
     *
     * @return this aggregator
     */
    public ValidationErrors append(Violation violation) {
        if (violation != null) {
            violations.add(violation);
        }
        return this;
    }

    public boolean isEmpty() {
        return violations.isEmpty();
    }

    public int size() {
        return violations.size();
    }

    /** Snapshot of the recorded violations in the order they were appended. */
    public List<Violation> violations() {
        return List.copyOf(violations);
    }

    /**
     * Renders all messages joined by {@code "; "} in append order, or {@code ""} when nothing has
     * been recorded.
     */
    public String message() {
        return join(violations);
    }

    /**
     * Produces the outcome of the pass: {@link ValidationResult#ok()} if nothing was recorded,
     * otherwise a failed result carrying every violation.
     */
    public ValidationResult toResult() {
        return violations.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(violations);
    }

    @Override
    public String toString() {
        return message();
    }

    static boolean anyField(List<Violation> violations, String field) {
        return violations.stream().anyMatch(v -> v.field().equals(field));
    }

    static boolean anyKind(List<Violation> violations, ViolationKind kind) {
        return violations.stream().anyMatch(v -> v.kind() == kind);
    }

    static String join(List<Violation> violations) {
        if (violations.isEmpty()) {
            return "";
        }
        var b = new StringBuilder();
        for (int i = 0; i < violations.size(); i++) {
            if (i > 0) {
                b.append(SEPARATOR);
            }
            b.append(violations.get(i).message());
        }
        return b.toString();
    }
}
