package com.civic.transparency.validation;

import static com.civic.transparency.validation.ViolationKind.INVALID_ENUM_VALUE;
import static com.civic.transparency.validation.ViolationKind.MALFORMED_FIXED_PATTERN;
import static com.civic.transparency.validation.ViolationKind.MALFORMED_VARIABLE_PATTERN;

import com.civic.transparency.types.AcctAgeBucket;
import com.civic.transparency.types.AcctType;
import com.civic.transparency.types.AutomationFlag;
import com.civic.transparency.types.ClientFamily;
import com.civic.transparency.types.MediaProvenance;
import com.civic.transparency.types.PostKind;
import com.civic.transparency.types.ProvenanceTag;
import com.civic.transparency.types.TransparencyPatterns;
import java.util.Objects;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates {@link ProvenanceTag} instances against the closed value sets and field patterns.
 *
 * <p>Every check runs regardless of earlier failures, so one call reports everything wrong with a
 * tag. Enum fields are checked in declaration order, then the dedup hash, then the origin hint.
 */
public final class ProvenanceTagValidator {

    private static final Logger log = LoggerFactory.getLogger(ProvenanceTagValidator.class);

    private ProvenanceTagValidator() {
        // utility class
    }

    /**
     * Validates a single tag.
     *
     * @param tag the tag to validate
     * @return a {@link ValidationResult} with every violation found
     */
    public static ValidationResult validate(ProvenanceTag tag) {
        Objects.requireNonNull(tag, "tag");
        var errors = new ValidationErrors();

        errors.append(member("acct_age_bucket", tag.acctAgeBucket(), AcctAgeBucket::isKnown));
        errors.append(member("acct_type", tag.acctType(), AcctType::isKnown));
        errors.append(member("automation_flag", tag.automationFlag(), AutomationFlag::isKnown));
        errors.append(member("post_kind", tag.postKind(), PostKind::isKnown));
        errors.append(member("client_family", tag.clientFamily(), ClientFamily::isKnown));
        errors.append(member("media_provenance", tag.mediaProvenance(), MediaProvenance::isKnown));

        if (!TransparencyPatterns.isHex8(tag.dedupHash())) {
            errors.append(new Violation("dedup_hash", MALFORMED_FIXED_PATTERN,
                    "dedup_hash must be 8 lowercase hex chars"));
        }
        errors.append(originHint(tag.originHint()));

        if (!errors.isEmpty()) {
            log.debug("ProvenanceTag failed validation with {} violation(s)", errors.size());
        }
        return errors.toResult();
    }

    private static Violation member(String field, String value, Predicate<String> known) {
        return known.test(value) ? null : new Violation(field, INVALID_ENUM_VALUE, "invalid " + field);
    }

    // Empty means "unknown origin" and is accepted.
    private static Violation originHint(String code) {
        if (code == null || code.isEmpty() || TransparencyPatterns.isIso3166(code)) {
            return null;
        }
        return new Violation("origin_hint", MALFORMED_VARIABLE_PATTERN,
                "origin_hint/country must match ISO-3166 pattern (e.g., US or US-CA)");
    }
}
