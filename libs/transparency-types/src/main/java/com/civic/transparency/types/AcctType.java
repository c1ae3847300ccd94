package com.civic.transparency.types;

import java.util.Optional;

/**
 * Self-declared or platform-verified kind of the posting account.
 *
 * <p>{@link #DECLARED_AUTOMATION} marks accounts that openly identify as automated; it is distinct
 * from the per-post {@link AutomationFlag}.
 */
public enum AcctType {
    PERSON("person"),
    ORG("org"),
    MEDIA("media"),
    PUBLIC_OFFICIAL("public_official"),
    UNVERIFIED("unverified"),
    DECLARED_AUTOMATION("declared_automation");

    private final String value;

    AcctType(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g. "public_official"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an account type by its canonical string value.
     *
     * @param value the string to match
     * @return the matching account type, or empty if not found
     */
    public static Optional<AcctType> fromString(String value) {
        for (AcctType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known account type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
