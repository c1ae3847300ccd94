package com.civic.transparency.validation;

import static com.civic.transparency.validation.ViolationKind.EMPTY_REQUIRED_COLLECTION;
import static com.civic.transparency.validation.ViolationKind.EMPTY_REQUIRED_FIELD;
import static com.civic.transparency.validation.ViolationKind.INVALID_ENUM_VALUE;
import static com.civic.transparency.validation.ViolationKind.OUT_OF_RANGE_VALUE;
import static com.civic.transparency.validation.ViolationKind.UNSET_REQUIRED_FIELD;

import com.civic.transparency.types.CoordinationSignals;
import com.civic.transparency.types.Interval;
import com.civic.transparency.types.Point;
import com.civic.transparency.types.Series;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a {@link Series} and every {@link Point} it contains.
 *
 * <p>Series-level checks come first, then each point in index order. Messages for a point carry
 * its index ({@code points[3].volume ...}) so callers need not re-scan the list. Ratio bounds are
 * inclusive at both ends and NaN is out of range.
 */
public final class SeriesValidator {

    /**
     * Zero value of a timestamp that was never set, {@code 0001-01-01T00:00:00Z}. Producers emit
     * it for a missing {@code generated_at}; the Unix epoch is an ordinary, valid time.
     */
    public static final Instant ZERO_TIME = Instant.parse("0001-01-01T00:00:00Z");

    private static final Logger log = LoggerFactory.getLogger(SeriesValidator.class);

    private SeriesValidator() {
        // utility class
    }

    /**
     * Validates a series and its points.
     *
     * @param series the series to validate
     * @return a {@link ValidationResult} with every violation found
     */
    public static ValidationResult validate(Series series) {
        Objects.requireNonNull(series, "series");
        var errors = new ValidationErrors();

        if (series.topic() == null || series.topic().isEmpty()) {
            errors.append(new Violation("topic", EMPTY_REQUIRED_FIELD,
                    "topic must be non-empty"));
        }
        if (isUnset(series.generatedAt())) {
            errors.append(new Violation("generated_at", UNSET_REQUIRED_FIELD,
                    "generated_at must be set"));
        }
        if (!Interval.MINUTE.value().equals(series.interval())) {
            errors.append(new Violation("interval", INVALID_ENUM_VALUE,
                    "interval must be \"" + Interval.MINUTE.value() + "\""));
        }

        List<Point> points = series.points();
        if (points.isEmpty()) {
            errors.append(new Violation("points", EMPTY_REQUIRED_COLLECTION,
                    "series must contain at least one point"));
        }
        for (int i = 0; i < points.size(); i++) {
            validatePoint(i, points.get(i), errors);
        }

        if (!errors.isEmpty()) {
            log.debug("Series '{}' failed validation with {} violation(s)", series.topic(), errors.size());
        }
        return errors.toResult();
    }

    private static void validatePoint(int index, Point p, ValidationErrors errors) {
        String prefix = "points[" + index + "]";
        if (p == null) {
            errors.append(new Violation(prefix, UNSET_REQUIRED_FIELD, prefix + " must be set"));
            return;
        }
        if (p.volume() < 0) {
            errors.append(nonNegative(prefix + ".volume"));
        }
        errors.append(unitRange(prefix + ".reshare_ratio", p.reshareRatio()));
        errors.append(unitRange(prefix + ".recycled_content_rate", p.recycledContentRate()));

        CoordinationSignals cs = p.coordinationSignals();
        String csPrefix = prefix + ".coordination_signals";
        if (cs == null) {
            errors.append(new Violation(csPrefix, UNSET_REQUIRED_FIELD, csPrefix + " must be set"));
            return;
        }
        errors.append(unitRange(csPrefix + ".burst_score", cs.burstScore()));
        errors.append(unitRange(csPrefix + ".synchrony_index", cs.synchronyIndex()));
        if (cs.duplicationClusters() < 0) {
            errors.append(nonNegative(csPrefix + ".duplication_clusters"));
        }
    }

    private static boolean isUnset(Instant t) {
        return t == null || ZERO_TIME.equals(t);
    }

    private static Violation unitRange(String field, double value) {
        if (value >= 0 && value <= 1) {
            return null;
        }
        return new Violation(field, OUT_OF_RANGE_VALUE, field + " must be 0–1");
    }

    private static Violation nonNegative(String field) {
        return new Violation(field, OUT_OF_RANGE_VALUE, field + " must be ≥0");
    }
}
