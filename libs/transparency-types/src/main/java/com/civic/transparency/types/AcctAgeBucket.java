package com.civic.transparency.types;

import java.util.Optional;

/**
 * Coarse age of the posting account at the time of the post.
 *
 * <p>Buckets are deliberately wide so a tag never identifies a single account. The {@code value}
 * field holds the canonical string used in the published schema.
 */
public enum AcctAgeBucket {
    DAYS_0_7("0-7d"),
    DAYS_8_30("8-30d"),
    MONTHS_1_6("1-6m"),
    MONTHS_6_24("6-24m"),
    MONTHS_24_PLUS("24m+");

    private final String value;

    AcctAgeBucket(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g. "8-30d"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a bucket by its canonical string value.
     *
     * @param value the string to match (e.g. "24m+")
     * @return the matching bucket, or empty if not found
     */
    public static Optional<AcctAgeBucket> fromString(String value) {
        for (AcctAgeBucket bucket : values()) {
            if (bucket.value.equals(value)) {
                return Optional.of(bucket);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known bucket. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
