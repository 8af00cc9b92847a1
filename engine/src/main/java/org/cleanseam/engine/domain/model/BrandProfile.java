package org.cleanseam.engine.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable quality signal for one brand.
 * Range checks happen when the profile is added to a catalog.
 */
public final class BrandProfile {

    private final String name;
    private final double qualityBaseline;
    private final double durabilityRating;
    private final double transparencyScore;
    private final PriceTier priceTier;
    private final Map<String, Double> categoryOverrides;
    private final List<String> aliases;
    private final String description;

    private BrandProfile(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.priceTier = Objects.requireNonNull(builder.priceTier, "priceTier must not be null");
        this.qualityBaseline = builder.qualityBaseline;
        this.durabilityRating = builder.durabilityRating;
        this.transparencyScore = builder.transparencyScore;
        this.categoryOverrides = Collections.unmodifiableMap(new HashMap<>(builder.categoryOverrides));
        this.aliases = List.copyOf(builder.aliases);
        this.description = builder.description;
    }

    public String getName() {
        return name;
    }

    public double getQualityBaseline() {
        return qualityBaseline;
    }

    public double getDurabilityRating() {
        return durabilityRating;
    }

    public double getTransparencyScore() {
        return transparencyScore;
    }

    public PriceTier getPriceTier() {
        return priceTier;
    }

    public Map<String, Double> getCategoryOverrides() {
        return categoryOverrides;
    }

    /**
     * Additive adjustment for a category, 0 when the brand has none.
     */
    public double getCategoryOverride(String itemType) {
        return categoryOverrides.getOrDefault(itemType, 0.0);
    }

    public List<String> getAliases() {
        return aliases;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return String.format("BrandProfile{name='%s', baseline=%.1f, tier=%s}",
                name, qualityBaseline, priceTier.getCode());
    }

    /**
     * Builder for BrandProfile.
     */
    public static final class Builder {
        private String name;
        private double qualityBaseline;
        private double durabilityRating;
        private double transparencyScore;
        private PriceTier priceTier;
        private Map<String, Double> categoryOverrides = Collections.emptyMap();
        private List<String> aliases = Collections.emptyList();
        private String description = "";

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder qualityBaseline(double qualityBaseline) {
            this.qualityBaseline = qualityBaseline;
            return this;
        }

        public Builder durabilityRating(double durabilityRating) {
            this.durabilityRating = durabilityRating;
            return this;
        }

        public Builder transparencyScore(double transparencyScore) {
            this.transparencyScore = transparencyScore;
            return this;
        }

        public Builder priceTier(PriceTier priceTier) {
            this.priceTier = priceTier;
            return this;
        }

        public Builder categoryOverrides(Map<String, Double> categoryOverrides) {
            this.categoryOverrides = categoryOverrides != null ? categoryOverrides : Collections.emptyMap();
            return this;
        }

        public Builder aliases(List<String> aliases) {
            this.aliases = aliases != null ? aliases : Collections.emptyList();
            return this;
        }

        public Builder description(String description) {
            this.description = description != null ? description : "";
            return this;
        }

        public BrandProfile build() {
            return new BrandProfile(this);
        }
    }
}
