/**
 * Mortality alerting rule engine.
 *
 * <p>
 * {@link com.mortalitysentinel.core.engine.RuleEngine} looks a model up in the
 * catalog, builds it via
 * {@link com.mortalitysentinel.core.engine.AlertModelFactory} and runs it over
 * every hospital series. Built-in model types:
 * </p>
 * <ul>
 * <li>{@link com.mortalitysentinel.core.engine.BaselineComparisonModel}:
 * current value against the highest value or mean + 1&sigma; of the
 * preceding 3 or 6 months</li>
 * <li>{@link com.mortalitysentinel.core.engine.IncreasingTrendModel}:
 * three strictly increasing monthly mortality rates</li>
 * </ul>
 *
 * <p>
 * Thresholds come from
 * {@link com.mortalitysentinel.core.engine.StatisticsCalculator}, which uses
 * the population standard deviation everywhere.
 * </p>
 *
 * @since 1.0.0
 */
package com.mortalitysentinel.core.engine;
