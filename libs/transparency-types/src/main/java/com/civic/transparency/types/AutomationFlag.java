package com.civic.transparency.types;

import java.util.Optional;

/** How a single post was produced. */
public enum AutomationFlag {
    MANUAL("manual"),
    SCHEDULED("scheduled"),
    API_CLIENT("api_client"),
    DECLARED_BOT("declared_bot");

    private final String value;

    AutomationFlag(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<AutomationFlag> fromString(String value) {
        for (AutomationFlag flag : values()) {
            if (flag.value.equals(value)) {
                return Optional.of(flag);
            }
        }
        return Optional.empty();
    }

    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
