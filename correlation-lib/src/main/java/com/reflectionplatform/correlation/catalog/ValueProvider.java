package com.reflectionplatform.correlation.catalog;

import java.time.LocalDate;
import java.util.OptionalDouble;

/**
 * Daily observations of one metric, backed by whatever store owns them
 * (health data, phone usage, journal).
 *
 * <p>Implementations must:
 * <ul>
 *   <li>return {@link OptionalDouble#empty()} for a day with no observation; missing
 *       data is a normal outcome, not an error</li>
 *   <li>answer the same value for the same day for the duration of one engine run</li>
 *   <li>throw {@link com.reflectionplatform.correlation.exception.ProviderUnavailableException}
 *       only when the backing store itself is unreachable</li>
 * </ul>
 */
@FunctionalInterface
public interface ValueProvider {

    OptionalDouble valueFor(LocalDate date);
}
