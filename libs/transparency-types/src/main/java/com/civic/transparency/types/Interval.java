package com.civic.transparency.types;

/**
 * Sampling interval of a {@link Series}.
 *
 * <p>Only per-minute series are published today, so this enum has a single constant.
 */
public enum Interval {
    MINUTE("minute");

    private final String value;

    Interval(String value) {
        this.value = value;
    }

    /** The canonical string representation. */
    public String value() {
        return value;
    }
}
