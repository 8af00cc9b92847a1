package org.cleanseam.engine.catalog;

import org.cleanseam.engine.domain.model.BrandProfile;
import org.cleanseam.engine.domain.model.CategoryProfile;
import org.cleanseam.engine.domain.model.ScoringConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable snapshot of brand profiles, category profiles and scoring configuration.
 * Construction validates every entry and fails with {@link CatalogLoadException}.
 */
public final class Catalog implements CatalogStore {

    private final Map<String, BrandProfile> brandsByKey;
    private final List<BrandProfile> brands;
    private final Map<String, CategoryProfile> categoriesByType;
    private final List<CategoryProfile> categories;
    private final ScoringConfig scoringConfig;

    private Catalog(Map<String, BrandProfile> brandsByKey, List<BrandProfile> brands,
                    Map<String, CategoryProfile> categoriesByType, ScoringConfig scoringConfig) {
        this.brandsByKey = Collections.unmodifiableMap(brandsByKey);
        this.brands = Collections.unmodifiableList(brands);
        this.categoriesByType = Collections.unmodifiableMap(categoriesByType);
        this.categories = List.copyOf(categoriesByType.values());
        this.scoringConfig = scoringConfig;
    }

    /**
     * Build and validate a catalog.
     *
     * @throws CatalogLoadException if any entry is out of range, two entries share a key
     *         or a brand overrides a category the catalog does not define
     */
    public static Catalog of(List<BrandProfile> brands, List<CategoryProfile> categories, ScoringConfig config) {
        Objects.requireNonNull(brands, "brands must not be null");
        Objects.requireNonNull(categories, "categories must not be null");
        Objects.requireNonNull(config, "config must not be null");

        Map<String, CategoryProfile> categoriesByType = new TreeMap<>();
        for (CategoryProfile category : categories) {
            validateCategory(category);
            String key = normalizeKey(category.getItemType());
            if (categoriesByType.put(key, category) != null) {
                throw new CatalogLoadException("Duplicate category: " + category.getItemType());
            }
        }

        // TreeMap keeps listBrands() alphabetical by normalized name
        Map<String, BrandProfile> primary = new TreeMap<>();
        Map<String, BrandProfile> brandsByKey = new TreeMap<>();
        for (BrandProfile brand : brands) {
            validateBrand(brand, categoriesByType);
            String key = normalizeKey(brand.getName());
            primary.put(key, brand);
            register(brandsByKey, key, brand);
            for (String alias : brand.getAliases()) {
                register(brandsByKey, normalizeKey(alias), brand);
            }
        }

        return new Catalog(brandsByKey, new ArrayList<>(primary.values()), categoriesByType, config);
    }

    /**
     * Normalize a brand name or item type for key comparison: trim, lower-case, collapse whitespace.
     * Returns an empty string for null.
     */
    public static String normalizeKey(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static void register(Map<String, BrandProfile> brandsByKey, String key, BrandProfile brand) {
        if (key.isEmpty()) {
            throw new CatalogLoadException("Brand name or alias must not be blank: " + brand.getName());
        }
        BrandProfile existing = brandsByKey.put(key, brand);
        if (existing != null && existing != brand) {
            throw new CatalogLoadException(String.format("Brand key '%s' is claimed by both %s and %s",
                    key, existing.getName(), brand.getName()));
        }
    }

    private static void validateCategory(CategoryProfile category) {
        String itemType = category.getItemType();
        if (itemType.trim().isEmpty()) {
            throw new CatalogLoadException("Category item_type must not be blank");
        }
        if (category.getBaseWearCount() <= 0) {
            throw new CatalogLoadException("Category " + itemType + " has non-positive base_wear_count: "
                    + category.getBaseWearCount());
        }
        if (!(category.getReferencePrice() > 0) || Double.isInfinite(category.getReferencePrice())) {
            throw new CatalogLoadException("Category " + itemType + " has non-positive reference_price: "
                    + category.getReferencePrice());
        }
        if (category.getBaseLifespanMonths() <= 0) {
            throw new CatalogLoadException("Category " + itemType + " has non-positive base_lifespan_months");
        }
        requirePercent(category.getAverageScore(), "average_score", itemType);
    }

    private static void validateBrand(BrandProfile brand, Map<String, CategoryProfile> categoriesByType) {
        String name = brand.getName();
        requirePercent(brand.getQualityBaseline(), "quality_baseline", name);
        requirePercent(brand.getDurabilityRating(), "durability_rating", name);
        requirePercent(brand.getTransparencyScore(), "transparency_score", name);
        for (String itemType : brand.getCategoryOverrides().keySet()) {
            if (!categoriesByType.containsKey(normalizeKey(itemType))) {
                throw new CatalogLoadException(String.format(
                        "Brand %s overrides unknown category '%s'", name, itemType));
            }
        }
    }

    private static void requirePercent(double value, String field, String owner) {
        if (!(value >= 0 && value <= 100)) {
            throw new CatalogLoadException(String.format("%s of %s must be within [0, 100], got %s",
                    field, owner, value));
        }
    }

    @Override
    public Optional<BrandProfile> lookupBrand(String name) {
        return Optional.ofNullable(brandsByKey.get(normalizeKey(name)));
    }

    @Override
    public Optional<CategoryProfile> lookupCategory(String itemType) {
        return Optional.ofNullable(categoriesByType.get(normalizeKey(itemType)));
    }

    @Override
    public List<CategoryProfile> listCategories() {
        return categories;
    }

    @Override
    public List<BrandProfile> listBrands() {
        return brands;
    }

    @Override
    public ScoringConfig getScoringConfig() {
        return scoringConfig;
    }

    @Override
    public Catalog snapshot() {
        return this;
    }

    @Override
    public String toString() {
        return "Catalog{brands=" + brands.size() + ", categories=" + categories.size() + "}";
    }
}
