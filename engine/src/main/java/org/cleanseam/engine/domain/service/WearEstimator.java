package org.cleanseam.engine.domain.service;

import org.cleanseam.engine.domain.model.CategoryProfile;
import org.cleanseam.engine.domain.model.ScoringConfig;
import org.cleanseam.engine.domain.model.Verdict;
import org.cleanseam.engine.domain.model.WearEstimate;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns a quality score into estimated wears and cost-per-wear.
 *
 * multiplier = min + (max - min) * score / 100
 * wears      = max(1, round(base_wear_count * multiplier))
 * cpw        = round(price / wears, 2)
 *
 * The multiplier never decreases with the score, so at a fixed category and price a
 * higher score can never give a higher cost-per-wear.
 */
public final class WearEstimator {

    public double multiplier(int qualityScore, ScoringConfig config) {
        double min = config.getMultiplierMin();
        double max = config.getMultiplierMax();
        return min + (max - min) * qualityScore / 100.0;
    }

    public WearEstimate estimate(CategoryProfile category, int qualityScore, double price, ScoringConfig config) {
        double multiplier = multiplier(qualityScore, config);
        int wears = atLeastOne(category.getBaseWearCount() * multiplier);
        int lifespan = atLeastOne(category.getBaseLifespanMonths() * multiplier);
        return new WearEstimate(wears, lifespan, costPerWear(price, wears));
    }

    /**
     * Price divided by wears, rounded half-up to cents.
     */
    public BigDecimal costPerWear(double price, int estimatedWears) {
        return BigDecimal.valueOf(price).divide(BigDecimal.valueOf(estimatedWears), 2, RoundingMode.HALF_UP);
    }

    public Verdict verdict(int qualityScore, ScoringConfig config) {
        return Verdict.forScore(qualityScore, config);
    }

    private static int atLeastOne(double value) {
        return (int) Math.max(1L, Math.round(value));
    }
}
