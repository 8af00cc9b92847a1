package org.cleanseam.engine.catalog;

/**
 * Produces a complete catalog snapshot. Today a JSON document; later a curated or scraped store.
 */
@FunctionalInterface
public interface CatalogSource {

    /**
     * @throws CatalogLoadException if the data cannot be read or is invalid
     */
    Catalog load();
}
