/**
 * Runnable alert service: CSV-backed time-series store, model evaluation
 * with per-complexity deadlines, Google Chat delivery, the HTTP API and the
 * process entry points.
 *
 * @since 1.0.0
 */
package com.mortalitysentinel.service;
