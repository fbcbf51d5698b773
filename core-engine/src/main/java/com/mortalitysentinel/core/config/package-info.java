/**
 * Model catalog loading and validation.
 *
 * <p>
 * Model definitions are declared in YAML and loaded by
 * {@link com.mortalitysentinel.core.config.ModelCatalogLoader} into a
 * {@link com.mortalitysentinel.core.config.ModelCatalogConfig}, which backs the
 * read-only {@link com.mortalitysentinel.core.config.ModelCatalog}.
 * </p>
 *
 * @since 1.0.0
 */
package com.mortalitysentinel.core.config;
