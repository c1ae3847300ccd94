package com.civic.transparency.types;

/**
 * Compact categorical metadata attached to a single post.
 *
 * <p>Categorical fields hold the canonical string values of their enums ({@link AcctAgeBucket},
 * {@link AcctType}, ...) rather than the enum constants themselves, so a tag received from an
 * untrusted producer can carry an unknown value and still be reported on. The constructor does
 * no checking; see {@code ProvenanceTagValidator}.
 *
 * @param acctAgeBucket account age bucket, one of {@link AcctAgeBucket}
 * @param acctType account type, one of {@link AcctType}
 * @param automationFlag how the post was produced, one of {@link AutomationFlag}
 * @param postKind one of {@link PostKind}
 * @param clientFamily one of {@link ClientFamily}
 * @param mediaProvenance one of {@link MediaProvenance}
 * @param dedupHash 8 lowercase hex characters fingerprinting the content
 * @param originHint optional ISO-3166 country or subdivision code (e.g. "US", "US-CA"); empty or
 *     null when unknown
 */
public record ProvenanceTag(
        String acctAgeBucket,
        String acctType,
        String automationFlag,
        String postKind,
        String clientFamily,
        String mediaProvenance,
        String dedupHash,
        String originHint) {}
