/**
 * Validation for civic transparency records.
 *
 * <p>{@link com.civic.transparency.validation.ProvenanceTagValidator} and {@link
 * com.civic.transparency.validation.SeriesValidator} are pure single-pass walks. Each call owns
 * a fresh {@link com.civic.transparency.validation.ValidationErrors} and returns a {@link
 * com.civic.transparency.validation.ValidationResult} listing every failed check. Use {@link
 * com.civic.transparency.validation.Validators#mustSeries} and friends where invalid input
 * should throw.
 */
package com.civic.transparency.validation;
