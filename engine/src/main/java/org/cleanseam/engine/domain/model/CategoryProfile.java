package org.cleanseam.engine.domain.model;

import java.util.Objects;

/**
 * Immutable reference data for one item type (e.g. "jeans").
 */
public final class CategoryProfile {

    public static final int DEFAULT_LIFESPAN_MONTHS = 18;
    public static final double DEFAULT_AVERAGE_SCORE = 50.0;

    private final String itemType;
    private final int baseWearCount;
    private final double referencePrice;
    private final int baseLifespanMonths;
    private final double averageScore;

    public CategoryProfile(String itemType, int baseWearCount, double referencePrice) {
        this(itemType, baseWearCount, referencePrice, DEFAULT_LIFESPAN_MONTHS, DEFAULT_AVERAGE_SCORE);
    }

    public CategoryProfile(String itemType, int baseWearCount, double referencePrice,
                           int baseLifespanMonths, double averageScore) {
        this.itemType = Objects.requireNonNull(itemType, "itemType must not be null");
        this.baseWearCount = baseWearCount;
        this.referencePrice = referencePrice;
        this.baseLifespanMonths = baseLifespanMonths;
        this.averageScore = averageScore;
    }

    public String getItemType() {
        return itemType;
    }

    public int getBaseWearCount() {
        return baseWearCount;
    }

    public double getReferencePrice() {
        return referencePrice;
    }

    public int getBaseLifespanMonths() {
        return baseLifespanMonths;
    }

    public double getAverageScore() {
        return averageScore;
    }

    @Override
    public String toString() {
        return String.format("CategoryProfile{itemType='%s', baseWears=%d, referencePrice=%.2f}",
                itemType, baseWearCount, referencePrice);
    }
}
