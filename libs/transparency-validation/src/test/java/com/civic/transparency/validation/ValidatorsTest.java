package com.civic.transparency.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.civic.transparency.types.Series;
import com.civic.transparency.types.testing.TestRecordFactory;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Tests for the Validators facade and its escalating must* variants.
 */
@DisplayName("Validators")
class ValidatorsTest {

    @Nested
    @DisplayName("validate()")
    class Validate {

        @Test
        @DisplayName("delegates to the record's validator")
        void delegates() {
            var tag = TestRecordFactory.provenanceTagWithDedupHash("nope");
            var series = TestRecordFactory.series(List.of());

            assertThat(Validators.validate(tag)).isEqualTo(ProvenanceTagValidator.validate(tag));
            assertThat(Validators.validate(series)).isEqualTo(SeriesValidator.validate(series));
        }
    }

    @Nested
    @DisplayName("mustProvenanceTag()")
    class MustProvenanceTag {

        @Test
        @DisplayName("returns normally for a valid tag")
        void valid() {
            assertThatCode(() -> Validators.mustProvenanceTag(TestRecordFactory.provenanceTag()))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("throws with every violation for an invalid tag")
        void invalid() {
            var tag = TestRecordFactory.provenanceTagWithAcctType("alien");
            assertThatThrownBy(() -> Validators.mustProvenanceTag(tag))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("invalid acct_type")
                    .satisfies(e -> assertThat(((ValidationException) e).hasViolation("acct_type")).isTrue());
        }
    }

    @Nested
    @DisplayName("mustSeries()")
    class MustSeries {

        @Test
        @DisplayName("returns normally for a valid series")
        void valid() {
            assertThatCode(() -> Validators.mustSeries(TestRecordFactory.series()))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("throws with every violation for an invalid series")
        void invalid() {
            Series s = TestRecordFactory.series("", TestRecordFactory.GENERATED_AT, "minute", List.of());
            assertThatThrownBy(() -> Validators.mustSeries(s))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("topic must be non-empty; series must contain at least one point")
                    .satisfies(e -> assertThat(((ValidationException) e).violations()).hasSize(2));
        }
    }

    @Nested
    @DisplayName("logging")
    class Logging {

        private final Logger logger = (Logger) LoggerFactory.getLogger(Validators.class);
        private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

        @BeforeEach
        void attach() {
            appender.start();
            logger.addAppender(appender);
        }

        @AfterEach
        void detach() {
            logger.detachAppender(appender);
            appender.stop();
        }

        @Test
        @DisplayName("escalation leaves WARN and ERROR logging to whoever handles the exception")
        void noWarnBeforeThrowing() {
            var tag = TestRecordFactory.provenanceTagWithDedupHash("nope");
            var series = TestRecordFactory.series(List.of());

            assertThatThrownBy(() -> Validators.mustProvenanceTag(tag)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> Validators.mustSeries(series)).isInstanceOf(ValidationException.class);

            assertThat(appender.list)
                    .isNotEmpty()
                    .allSatisfy(e -> assertThat(e.getLevel().isGreaterOrEqual(Level.WARN)).isFalse());
        }
    }
}
