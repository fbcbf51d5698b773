/**
 * Time-series data access consumed by the rule engine.
 *
 * <p>
 * {@link com.mortalitysentinel.core.store.TimeSeriesStore} is the boundary to
 * whatever holds the monthly records (a warehouse, a database, CSV files).
 * {@link com.mortalitysentinel.core.store.InMemoryTimeSeriesStore} is an
 * immutable snapshot for embedding and tests.
 * </p>
 *
 * @since 1.0.0
 */
package com.mortalitysentinel.core.store;
