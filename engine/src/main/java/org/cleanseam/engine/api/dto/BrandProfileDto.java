package org.cleanseam.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.cleanseam.engine.domain.model.BrandProfile;

import java.util.Map;
import java.util.TreeMap;

/**
 * Response DTO for GET /brand/{name}.
 */
public final class BrandProfileDto {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("quality_baseline")
    private final double qualityBaseline;

    @JsonProperty("durability_rating")
    private final double durabilityRating;

    @JsonProperty("transparency_score")
    private final double transparencyScore;

    @JsonProperty("price_tier")
    private final String priceTier;

    @JsonProperty("typical_price_range")
    private final String typicalPriceRange;

    @JsonProperty("category_overrides")
    private final Map<String, Double> categoryOverrides;

    private BrandProfileDto(BrandProfile profile) {
        this.name = profile.getName();
        this.description = profile.getDescription();
        this.qualityBaseline = profile.getQualityBaseline();
        this.durabilityRating = profile.getDurabilityRating();
        this.transparencyScore = profile.getTransparencyScore();
        this.priceTier = profile.getPriceTier().getCode();
        this.typicalPriceRange = profile.getPriceTier().getTypicalPriceRange();
        this.categoryOverrides = new TreeMap<>(profile.getCategoryOverrides());
    }

    public static BrandProfileDto from(BrandProfile profile) {
        return new BrandProfileDto(profile);
    }
}
