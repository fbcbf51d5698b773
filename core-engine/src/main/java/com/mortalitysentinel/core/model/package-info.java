/**
 * Domain model classes for Mortality Sentinel.
 *
 * <p>
 * Inputs to the engine ({@link com.mortalitysentinel.core.model.MonthlyRecord},
 * {@link com.mortalitysentinel.core.model.ExpectedDeathInfo}), the model
 * configuration ({@link com.mortalitysentinel.core.model.ModelDefinition}) and
 * the engine's output ({@link com.mortalitysentinel.core.model.AlertResult}).
 * All output types are immutable.
 * </p>
 *
 * @since 1.0.0
 */
package com.mortalitysentinel.core.model;
