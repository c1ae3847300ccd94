package com.civic.transparency.types;

import java.util.Optional;

/** Coarse family of the client a post was made from. */
public enum ClientFamily {
    WEB("web"),
    MOBILE("mobile"),
    THIRD_PARTY("third_party");

    private final String value;

    ClientFamily(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ClientFamily> fromString(String value) {
        for (ClientFamily family : values()) {
            if (family.value.equals(value)) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }

    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
