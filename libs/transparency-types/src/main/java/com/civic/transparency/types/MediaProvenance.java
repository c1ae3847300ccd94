package com.civic.transparency.types;

import java.util.Optional;

/**
 * What provenance evidence accompanies attached media.
 *
 * <ul>
 *   <li>{@link #C2PA_PRESENT}: a C2PA manifest was found on the media
 *   <li>{@link #HASH_ONLY}: only a perceptual or content hash is known
 *   <li>{@link #NONE}: no provenance information
 * </ul>
 */
public enum MediaProvenance {
    C2PA_PRESENT("c2pa_present"),
    HASH_ONLY("hash_only"),
    NONE("none");

    private final String value;

    MediaProvenance(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g. "hash_only"). */
    public String value() {
        return value;
    }

    public static Optional<MediaProvenance> fromString(String value) {
        for (MediaProvenance provenance : values()) {
            if (provenance.value.equals(value)) {
                return Optional.of(provenance);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known provenance kind. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
