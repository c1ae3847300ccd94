package com.civic.transparency.types;

/**
 * Derived metrics hinting at coordinated posting within one {@link Point}.
 *
 * @param burstScore how bursty the volume was, 0 to 1
 * @param synchronyIndex how closely posting times line up across accounts, 0 to 1
 * @param duplicationClusters number of near-duplicate content clusters observed
 */
public record CoordinationSignals(double burstScore, double synchronyIndex, int duplicationClusters) {}
