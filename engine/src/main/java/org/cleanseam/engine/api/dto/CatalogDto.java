package org.cleanseam.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * On-disk shape of the catalog document (catalog.json).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CatalogDto {

    @JsonProperty("config")
    private List<ConfigItemDto> config;

    @JsonProperty("categories")
    private List<CategoryDto> categories;

    @JsonProperty("brands")
    private List<BrandDto> brands;

    public List<ConfigItemDto> getConfig() {
        return config;
    }

    public void setConfig(List<ConfigItemDto> config) {
        this.config = config;
    }

    public List<CategoryDto> getCategories() {
        return categories;
    }

    public void setCategories(List<CategoryDto> categories) {
        this.categories = categories;
    }

    public List<BrandDto> getBrands() {
        return brands;
    }

    public void setBrands(List<BrandDto> brands) {
        this.brands = brands;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConfigItemDto {
        @JsonProperty("key")
        private String key;

        @JsonProperty("value")
        private Double value;

        @JsonProperty("description")
        private String description;

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public Double getValue() {
            return value;
        }

        public void setValue(Double value) {
            this.value = value;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CategoryDto {
        @JsonProperty("item_type")
        private String itemType;

        @JsonProperty("base_wear_count")
        private Integer baseWearCount;

        @JsonProperty("reference_price")
        private Double referencePrice;

        @JsonProperty("base_lifespan_months")
        private Integer baseLifespanMonths;

        @JsonProperty("average_score")
        private Double averageScore;

        public String getItemType() {
            return itemType;
        }

        public void setItemType(String itemType) {
            this.itemType = itemType;
        }

        public Integer getBaseWearCount() {
            return baseWearCount;
        }

        public void setBaseWearCount(Integer baseWearCount) {
            this.baseWearCount = baseWearCount;
        }

        public Double getReferencePrice() {
            return referencePrice;
        }

        public void setReferencePrice(Double referencePrice) {
            this.referencePrice = referencePrice;
        }

        public Integer getBaseLifespanMonths() {
            return baseLifespanMonths;
        }

        public void setBaseLifespanMonths(Integer baseLifespanMonths) {
            this.baseLifespanMonths = baseLifespanMonths;
        }

        public Double getAverageScore() {
            return averageScore;
        }

        public void setAverageScore(Double averageScore) {
            this.averageScore = averageScore;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BrandDto {
        @JsonProperty("name")
        private String name;

        @JsonProperty("aliases")
        private List<String> aliases;

        @JsonProperty("description")
        private String description;

        @JsonProperty("quality_baseline")
        private Double qualityBaseline;

        @JsonProperty("durability_rating")
        private Double durabilityRating;

        @JsonProperty("transparency_score")
        private Double transparencyScore;

        @JsonProperty("price_tier")
        private String priceTier;

        @JsonProperty("category_overrides")
        private Map<String, Double> categoryOverrides;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getAliases() {
            return aliases;
        }

        public void setAliases(List<String> aliases) {
            this.aliases = aliases;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public Double getQualityBaseline() {
            return qualityBaseline;
        }

        public void setQualityBaseline(Double qualityBaseline) {
            this.qualityBaseline = qualityBaseline;
        }

        public Double getDurabilityRating() {
            return durabilityRating;
        }

        public void setDurabilityRating(Double durabilityRating) {
            this.durabilityRating = durabilityRating;
        }

        public Double getTransparencyScore() {
            return transparencyScore;
        }

        public void setTransparencyScore(Double transparencyScore) {
            this.transparencyScore = transparencyScore;
        }

        public String getPriceTier() {
            return priceTier;
        }

        public void setPriceTier(String priceTier) {
            this.priceTier = priceTier;
        }

        public Map<String, Double> getCategoryOverrides() {
            return categoryOverrides;
        }

        public void setCategoryOverrides(Map<String, Double> categoryOverrides) {
            this.categoryOverrides = categoryOverrides;
        }
    }
}
