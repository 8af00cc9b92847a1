package org.cleanseam.engine.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Projected wears, lifespan and cost-per-wear for one scored item.
 */
public final class WearEstimate {

    private final int estimatedWears;
    private final int estimatedLifespanMonths;
    private final BigDecimal costPerWear;

    public WearEstimate(int estimatedWears, int estimatedLifespanMonths, BigDecimal costPerWear) {
        if (estimatedWears < 1) {
            throw new IllegalArgumentException("estimatedWears must be at least 1");
        }
        this.estimatedWears = estimatedWears;
        this.estimatedLifespanMonths = estimatedLifespanMonths;
        this.costPerWear = Objects.requireNonNull(costPerWear, "costPerWear must not be null");
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
}
