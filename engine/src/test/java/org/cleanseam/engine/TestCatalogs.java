package org.cleanseam.engine;

import org.cleanseam.engine.catalog.Catalog;
import org.cleanseam.engine.catalog.CatalogLoader;
import org.cleanseam.engine.domain.model.BrandProfile;
import org.cleanseam.engine.domain.model.CategoryProfile;
import org.cleanseam.engine.domain.model.PriceTier;
import org.cleanseam.engine.domain.model.ScoringConfig;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Shared catalog fixtures for tests.
 */
public final class TestCatalogs {

    private TestCatalogs() {
    }

    /**
     * The catalog bundled with the engine.
     */
    public static Catalog bundled() {
        return new CatalogLoader().classpathSource(CatalogLoader.DEFAULT_RESOURCE).load();
    }

    /**
     * Parse a JSON document written with single quotes, to keep fixtures readable.
     */
    public static Catalog parse(String singleQuotedJson) {
        String json = singleQuotedJson.replace('\'', '"');
        return new CatalogLoader().parse(
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "test");
    }

    public static CategoryProfile jeans() {
        return new CategoryProfile("jeans", 100, 50.0, 24, 52.0);
    }

    /**
     * A brand whose known-path score is exactly {@code score}: no durability,
     * transparency or overrides.
     */
    public static BrandProfile flatBrand(String name, double score) {
        return new BrandProfile.Builder()
                .name(name)
                .qualityBaseline(score)
                .durabilityRating(0)
                .transparencyScore(0)
                .priceTier(PriceTier.MID)
                .build();
    }

    public static BrandProfile brand(String name, double baseline, double durability, double transparency,
                                     Map<String, Double> overrides) {
        return new BrandProfile.Builder()
                .name(name)
                .qualityBaseline(baseline)
                .durabilityRating(durability)
                .transparencyScore(transparency)
                .priceTier(PriceTier.MID)
                .categoryOverrides(overrides)
                .build();
    }

    public static Catalog of(List<BrandProfile> brands, CategoryProfile... categories) {
        return Catalog.of(brands, List.of(categories), ScoringConfig.defaults());
    }

    public static Catalog jeansOnly(BrandProfile... brands) {
        return of(List.of(brands), jeans());
    }

    public static Catalog empty() {
        return of(Collections.emptyList(), jeans());
    }
}
