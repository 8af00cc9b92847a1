package org.cleanseam.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.cleanseam.engine.domain.model.Alternative;
import org.cleanseam.engine.domain.model.AnalysisResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Response DTO for one analysis, also used for each ranked comparison entry.
 */
public final class AnalysisResultDto {

    @JsonProperty("brand")
    private final String brand;

    @JsonProperty("item_type")
    private final String itemType;

    @JsonProperty("price")
    private final double price;

    @JsonProperty("currency")
    private final String currency;

    @JsonProperty("quality_score")
    private final int qualityScore;

    @JsonProperty("estimated_wears")
    private final int estimatedWears;

    @JsonProperty("estimated_lifespan_months")
    private final int estimatedLifespanMonths;

    @JsonProperty("cost_per_wear")
    private final BigDecimal costPerWear;

    @JsonProperty("verdict")
    private final String verdict;

    @JsonProperty("fallback_used")
    private final boolean fallbackUsed;

    @JsonProperty("breakdown")
    private final Map<String, Double> breakdown;

    @JsonProperty("summary")
    private final String summary;

    @JsonProperty("category_average")
    private final double categoryAverage;

    @JsonProperty("better_alternatives")
    private final List<AlternativeDto> betterAlternatives;

    private AnalysisResultDto(AnalysisResult result) {
        this.brand = result.getBrand();
        this.itemType = result.getItemType();
        this.price = result.getPrice();
        this.currency = result.getCurrency();
        this.qualityScore = result.getQualityScore();
        this.estimatedWears = result.getEstimatedWears();
        this.estimatedLifespanMonths = result.getEstimatedLifespanMonths();
        this.costPerWear = result.getCostPerWear();
        this.verdict = result.getVerdict().getLabel();
        this.fallbackUsed = result.isFallbackUsed();
        this.breakdown = result.getBreakdown();
        this.summary = result.getSummary();
        this.categoryAverage = result.getCategoryAverage();
        this.betterAlternatives = result.getBetterAlternatives().stream()
                .map(AlternativeDto::new)
                .collect(Collectors.toList());
    }

    public static AnalysisResultDto from(AnalysisResult result) {
        return new AnalysisResultDto(result);
    }

    public static final class AlternativeDto {
        @JsonProperty("brand")
        private final String brand;

        @JsonProperty("quality_score")
        private final int qualityScore;

        @JsonProperty("typical_price_range")
        private final String typicalPriceRange;

        AlternativeDto(Alternative alternative) {
            this.brand = alternative.getBrand();
            this.qualityScore = alternative.getQualityScore();
            this.typicalPriceRange = alternative.getTypicalPriceRange();
        }
    }
}
