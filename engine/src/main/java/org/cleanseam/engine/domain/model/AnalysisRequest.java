package org.cleanseam.engine.domain.model;

import java.util.Objects;

/**
 * Validated analysis request: price is positive and the category exists in the catalog.
 */
public final class AnalysisRequest {

    private final String brandKey;
    private final String submittedBrand;
    private final CategoryProfile category;
    private final double price;
    private final String currency;

    public AnalysisRequest(String brandKey, String submittedBrand, CategoryProfile category,
                           double price, String currency) {
        this.brandKey = Objects.requireNonNull(brandKey, "brandKey must not be null");
        this.submittedBrand = Objects.requireNonNull(submittedBrand, "submittedBrand must not be null");
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.price = price;
        this.currency = Objects.requireNonNull(currency, "currency must not be null");
    }

    /**
     * Normalized brand used for catalog lookups.
     */
    public String getBrandKey() {
        return brandKey;
    }

    /**
     * Brand as the caller wrote it, trimmed.
     */
    public String getSubmittedBrand() {
        return submittedBrand;
    }

    public CategoryProfile getCategory() {
        return category;
    }

    public double getPrice() {
        return price;
    }

    public String getCurrency() {
        return currency;
    }
}
