package com.civic.transparency.types;

/**
 * One time-bucketed sample within a {@link Series}.
 *
 * @param volume number of posts in the bucket
 * @param reshareRatio share of posts that were reshares, 0 to 1
 * @param recycledContentRate share of posts whose content was seen before, 0 to 1
 * @param coordinationSignals coordination metrics for the bucket
 */
public record Point(
        long volume,
        double reshareRatio,
        double recycledContentRate,
        CoordinationSignals coordinationSignals) {}
