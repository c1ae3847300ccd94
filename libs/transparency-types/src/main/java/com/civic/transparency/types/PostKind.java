package com.civic.transparency.types;

import java.util.Optional;

/** How a post relates to other content. */
public enum PostKind {
    ORIGINAL("original"),
    RESHARE("reshare"),
    QUOTE("quote"),
    REPLY("reply");

    private final String value;

    PostKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<PostKind> fromString(String value) {
        for (PostKind kind : values()) {
            if (kind.value.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
