package org.cleanseam.engine.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable outcome of one quality and cost-per-wear analysis.
 */
public final class AnalysisResult {

    private final String brand;
    private final String itemType;
    private final double price;
    private final String currency;
    private final int qualityScore;
    private final int estimatedWears;
    private final int estimatedLifespanMonths;
    private final BigDecimal costPerWear;
    private final Verdict verdict;
    private final boolean fallbackUsed;
    private final Map<String, Double> breakdown;
    private final String summary;
    private final double categoryAverage;
    private final List<Alternative> betterAlternatives;

    private AnalysisResult(Builder builder) {
        this.brand = Objects.requireNonNull(builder.brand, "brand must not be null");
        this.itemType = Objects.requireNonNull(builder.itemType, "itemType must not be null");
        this.costPerWear = Objects.requireNonNull(builder.costPerWear, "costPerWear must not be null");
        this.verdict = Objects.requireNonNull(builder.verdict, "verdict must not be null");
        this.price = builder.price;
        this.currency = builder.currency;
        this.qualityScore = builder.qualityScore;
        this.estimatedWears = builder.estimatedWears;
        this.estimatedLifespanMonths = builder.estimatedLifespanMonths;
        this.fallbackUsed = builder.fallbackUsed;
        this.breakdown = Collections.unmodifiableMap(new LinkedHashMap<>(builder.breakdown));
        this.summary = builder.summary;
        this.categoryAverage = builder.categoryAverage;
        this.betterAlternatives = List.copyOf(builder.betterAlternatives);
    }

    // Getters
    public String getBrand() {
        return brand;
    }

    public String getItemType() {
        return itemType;
    }

    public double getPrice() {
        return price;
    }

    public String getCurrency() {
        return currency;
    }

    public int getQualityScore() {
        return qualityScore;
    }

    public int getEstimatedWears() {
        return estimatedWears;
    }

    public int getEstimatedLifespanMonths() {
        return estimatedLifespanMonths;
    }

    public BigDecimal getCostPerWear() {
        return costPerWear;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public boolean isFallbackUsed() {
        return fallbackUsed;
    }

    public Map<String, Double> getBreakdown() {
        return breakdown;
    }

    public String getSummary() {
        return summary;
    }

    public double getCategoryAverage() {
        return categoryAverage;
    }

    public List<Alternative> getBetterAlternatives() {
        return betterAlternatives;
    }

    @Override
    public String toString() {
        return String.format("AnalysisResult{brand='%s', itemType='%s', score=%d, wears=%d, cpw=%s, fallback=%s}",
                brand, itemType, qualityScore, estimatedWears, costPerWear.toPlainString(), fallbackUsed);
    }

    /**
     * Builder for AnalysisResult.
     */
    public static final class Builder {
        private String brand;
        private String itemType;
        private double price;
        private String currency = AnalysisInput.DEFAULT_CURRENCY;
        private int qualityScore;
        private int estimatedWears;
        private int estimatedLifespanMonths;
        private BigDecimal costPerWear;
        private Verdict verdict;
        private boolean fallbackUsed;
        private Map<String, Double> breakdown = Collections.emptyMap();
        private String summary = "";
        private double categoryAverage;
        private List<Alternative> betterAlternatives = Collections.emptyList();

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder itemType(String itemType) {
            this.itemType = itemType;
            return this;
        }

        public Builder price(double price) {
            this.price = price;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder score(ScoreOutcome outcome) {
            this.qualityScore = outcome.getQualityScore();
            this.fallbackUsed = outcome.isFallbackUsed();
            this.breakdown = outcome.getBreakdown();
            return this;
        }

        public Builder estimate(WearEstimate estimate) {
            this.estimatedWears = estimate.getEstimatedWears();
            this.estimatedLifespanMonths = estimate.getEstimatedLifespanMonths();
            this.costPerWear = estimate.getCostPerWear();
            return this;
        }

        public Builder verdict(Verdict verdict) {
            this.verdict = verdict;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder categoryAverage(double categoryAverage) {
            this.categoryAverage = categoryAverage;
            return this;
        }

        public Builder betterAlternatives(List<Alternative> betterAlternatives) {
            this.betterAlternatives = betterAlternatives;
            return this;
        }

        public AnalysisResult build() {
            return new AnalysisResult(this);
        }
    }
}
