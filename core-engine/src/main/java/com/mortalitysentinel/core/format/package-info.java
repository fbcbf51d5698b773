/**
 * Output formats for engine results.
 *
 * <p>
 * Formatters only render what the engine returned; none of them re-derives a
 * status or threshold.
 * </p>
 * <ul>
 * <li>{@link com.mortalitysentinel.core.format.AlertCsvFormatter}: CSV export
 * and re-import</li>
 * <li>{@link com.mortalitysentinel.core.format.ChatMessageFormatter}: chat
 * webhook text</li>
 * <li>{@link com.mortalitysentinel.core.format.AlertJson}: JSON mapper
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.mortalitysentinel.core.format;
