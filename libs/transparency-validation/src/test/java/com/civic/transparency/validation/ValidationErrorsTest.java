package com.civic.transparency.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the per-call error aggregator.
 */
@DisplayName("ValidationErrors")
class ValidationErrorsTest {

    private static final Violation A = new Violation("a", ViolationKind.EMPTY_REQUIRED_FIELD, "a must be set");
    private static final Violation B = new Violation("b", ViolationKind.OUT_OF_RANGE_VALUE, "b out of range");
    private static final Violation C = new Violation("c", ViolationKind.INVALID_ENUM_VALUE, "invalid c");

    @Nested
    @DisplayName("when empty")
    class Empty {

        @Test
        @DisplayName("renders an empty message without failing")
        void emptyMessage() {
            var errors = new ValidationErrors();
            assertThatCode(errors::message).doesNotThrowAnyException();
            assertThat(errors.message()).isEmpty();
            assertThat(errors.toString()).isEmpty();
            assertThat(errors.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("toResult returns the ok result, never a failure with no violations")
        void okResult() {
            var result = new ValidationErrors().toResult();
            assertThat(result).isSameAs(ValidationResult.ok());
            assertThat(result.valid()).isTrue();
            assertThat(result.error()).isEmpty();
        }
    }

    @Nested
    @DisplayName("append()")
    class Append {

        @Test
        @DisplayName("ignores null")
        void ignoresNull() {
            var errors = new ValidationErrors().append(null);
            assertThat(errors.isEmpty()).isTrue();
            assertThat(errors.toResult().valid()).isTrue();
        }

        @Test
        @DisplayName("keeps append order")
        void keepsOrder() {
            var errors = new ValidationErrors().append(B).append(null).append(A).append(C);
            assertThat(errors.size()).isEqualTo(3);
            assertThat(errors.violations()).containsExactly(B, A, C);
        }

        @Test
        @DisplayName("violations() is a snapshot")
        void snapshot() {
            var errors = new ValidationErrors().append(A);
            var snapshot = errors.violations();
            errors.append(B);
            assertThat(snapshot).containsExactly(A);
        }
    }

    @Nested
    @DisplayName("message()")
    class Message {

        @Test
        @DisplayName("single violation renders without separator")
        void single() {
            assertThat(new ValidationErrors().append(A).message()).isEqualTo("a must be set");
        }

        @Test
        @DisplayName("joins with \"; \" in append order")
        void joined() {
            var errors = new ValidationErrors().append(A).append(B).append(C);
            assertThat(errors.message()).isEqualTo("a must be set; b out of range; invalid c");
        }
    }

    @Test
    @DisplayName("toResult carries every violation and matches the aggregator text")
    void failedResult() {
        var errors = new ValidationErrors().append(A).append(B);
        var result = errors.toResult();

        assertThat(result.valid()).isFalse();
        assertThat(result.violations()).containsExactly(A, B);
        assertThat(result.message()).isEqualTo(errors.message());
    }
}
