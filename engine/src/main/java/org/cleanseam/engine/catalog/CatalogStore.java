package org.cleanseam.engine.catalog;

import org.cleanseam.engine.domain.model.BrandProfile;
import org.cleanseam.engine.domain.model.CategoryProfile;
import org.cleanseam.engine.domain.model.ScoringConfig;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to brand and category reference data.
 */
public interface CatalogStore {

    /**
     * Find a brand by name. Lookups are trimmed, case-folded and whitespace-collapsed.
     */
    Optional<BrandProfile> lookupBrand(String name);

    /**
     * Find a category by item type, case-insensitively.
     */
    Optional<CategoryProfile> lookupCategory(String itemType);

    /**
     * All categories, alphabetical by item type.
     */
    List<CategoryProfile> listCategories();

    /**
     * All brands, alphabetical by normalized name.
     */
    List<BrandProfile> listBrands();

    /**
     * Scoring weights that ship with this catalog.
     */
    ScoringConfig getScoringConfig();

    /**
     * A consistent view of the catalog. Callers that need several lookups for one
     * operation should take a snapshot once and query it.
     */
    Catalog snapshot();
}
