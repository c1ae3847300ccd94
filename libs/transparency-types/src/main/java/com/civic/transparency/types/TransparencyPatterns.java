package com.civic.transparency.types;

import java.util.regex.Pattern;

/**
 * Precompiled patterns for the fixed-shape string fields of the schema.
 */
public final class TransparencyPatterns {

    /** Exactly 8 lowercase hex characters, e.g. a dedup hash. */
    public static final Pattern HEX8 = Pattern.compile("^[0-9a-f]{8}$");

    /** ISO-3166-1 alpha-2 country, optionally followed by an ISO-3166-2 subdivision suffix. */
    public static final Pattern ISO3166 = Pattern.compile("^[A-Z]{2}(-[A-Z0-9]{1,3})?$");

    private TransparencyPatterns() {
        // utility class
    }

    public static boolean isHex8(String s) {
        return s != null && HEX8.matcher(s).matches();
    }

    /** Returns true for "US" or "US-CA" shaped codes; null never matches. */
    public static boolean isIso3166(String s) {
        return s != null && ISO3166.matcher(s).matches();
    }
}
