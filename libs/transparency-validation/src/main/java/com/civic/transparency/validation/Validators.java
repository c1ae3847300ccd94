package com.civic.transparency.validation;

import com.civic.transparency.types.ProvenanceTag;
import com.civic.transparency.types.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points for validating transparency records, including the escalating {@code must*}
 * variants.
 * <p>
 * The {@code must*} methods are for call sites that treat an invalid record as a bug: they throw
 * instead of returning a result. They add no checks of their own; {@link ProvenanceTagValidator}
 * and {@link SeriesValidator} never throw on invalid data.
 */
public final class Validators {

    private static final Logger log = LoggerFactory.getLogger(Validators.class);

    private Validators() {
        // utility class
    }

    public static ValidationResult validate(ProvenanceTag tag) {
        return ProvenanceTagValidator.validate(tag);
    }

    public static ValidationResult validate(Series series) {
        return SeriesValidator.validate(series);
    }

    /**
     * Validates the tag and throws if it is invalid.
     *
     * @throws ValidationException carrying every violation
     */
    public static void mustProvenanceTag(ProvenanceTag tag) {
        escalate("ProvenanceTag", ProvenanceTagValidator.validate(tag));
    }

    /**
     * Validates the series and throws if it is invalid.
     *
     * @throws ValidationException carrying every violation
     */
    public static void mustSeries(Series series) {
        escalate("Series", SeriesValidator.validate(series));
    }

    private static void escalate(String recordType, ValidationResult result) {
        if (!result.valid()) {
            log.debug("Escalating invalid {}: {}", recordType, result.message());
            result.orThrow();
        }
    }
}
