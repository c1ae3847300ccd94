/**
 * Record schema for civic transparency data.
 *
 * <p>Two top-level records are published: {@link com.civic.transparency.types.ProvenanceTag},
 * attached to individual posts, and {@link com.civic.transparency.types.Series}, an aggregated
 * per-minute time series for a topic. Closed value sets are modelled as enums exposing their
 * canonical string through {@code value()}; records carry those strings.
 *
 * @see com.civic.transparency.types.TransparencyPatterns
 */
package com.civic.transparency.types;
