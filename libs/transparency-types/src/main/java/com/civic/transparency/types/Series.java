package com.civic.transparency.types;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregated activity for one topic, sampled at a fixed {@link Interval}.
 *
 * <p>Points are copied into an unmodifiable list. Null elements are kept (unlike {@code
 * List.copyOf}) so that they can be reported by position; a null list becomes empty.
 *
 * @param topic non-empty topic label
 * @param generatedAt when the series was produced
 * @param interval canonical value of the sampling interval, currently always "minute"
 * @param points ordered samples, oldest first
 */
public record Series(String topic, Instant generatedAt, String interval, List<Point> points) {

    public Series {
        points = points == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(points));
    }
}
