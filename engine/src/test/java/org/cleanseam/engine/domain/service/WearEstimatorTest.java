package org.cleanseam.engine.domain.service;

import org.cleanseam.engine.TestCatalogs;
import org.cleanseam.engine.domain.model.CategoryProfile;
import org.cleanseam.engine.domain.model.ScoringConfig;
import org.cleanseam.engine.domain.model.Verdict;
import org.cleanseam.engine.domain.model.WearEstimate;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WearEstimatorTest {

    private final WearEstimator estimator = new WearEstimator();
    private final ScoringConfig config = ScoringConfig.defaults();
    private final CategoryProfile jeans = TestCatalogs.jeans();

    @Test
    void multiplier_isLinearFromHalfToDouble() {
        assertEquals(0.5, estimator.multiplier(0, config), 1e-12);
        assertEquals(1.25, estimator.multiplier(50, config), 1e-12);
        assertEquals(2.0, estimator.multiplier(100, config), 1e-12);
    }

    @Test
    void estimate_scalesBaseWearsAndDividesPrice() {
        WearEstimate estimate = estimator.estimate(jeans, 60, 70.0, config);

        // 100 * (0.5 + 1.5 * 0.6) = 140 wears
        assertEquals(140, estimate.getEstimatedWears());
        assertEquals(new BigDecimal("0.50"), estimate.getCostPerWear());
        // 24 * 1.4 = 33.6 months
        assertEquals(34, estimate.getEstimatedLifespanMonths());
    }

    @Test
    void costPerWear_isPriceOverWearsRoundedToCents() {
        assertEquals(new BigDecimal("3.33"), estimator.costPerWear(10.0, 3));
        assertEquals(new BigDecimal("0.01"), estimator.costPerWear(0.05, 10));
        assertEquals(new BigDecimal("49.99"), estimator.costPerWear(49.99, 1));

        for (int score = 0; score <= 100; score += 7) {
            WearEstimate estimate = estimator.estimate(jeans, score, 49.99, config);
            assertEquals(estimator.costPerWear(49.99, estimate.getEstimatedWears()), estimate.getCostPerWear());
            assertEquals(2, estimate.getCostPerWear().scale());
        }
    }

    @Test
    void estimatedWears_neverDropsBelowOne() {
        CategoryProfile tiny = new CategoryProfile("socks", 1, 5.0);
        ScoringConfig lowFloor = ScoringConfig.fromMap(Map.of(ScoringConfig.MULTIPLIER_MIN, 0.1));

        WearEstimate estimate = estimator.estimate(tiny, 0, 5.0, lowFloor);

        assertEquals(1, estimate.getEstimatedWears());
        assertEquals(new BigDecimal("5.00"), estimate.getCostPerWear());
        assertTrue(estimate.getEstimatedLifespanMonths() >= 1);
    }

    @Test
    void higherScore_neverCostsMorePerWear() {
        CategoryProfile[] categories = {
                jeans, new CategoryProfile("dress", 40, 60.0), new CategoryProfile("odd", 7, 3.0)
        };
        double[] prices = {0.99, 19.99, 49.99, 250.0};

        for (CategoryProfile category : categories) {
            for (double price : prices) {
                BigDecimal previous = null;
                int previousWears = 0;
                for (int score = 0; score <= 100; score++) {
                    WearEstimate estimate = estimator.estimate(category, score, price, config);
                    assertTrue(estimate.getEstimatedWears() >= previousWears);
                    if (previous != null) {
                        assertTrue(estimate.getCostPerWear().compareTo(previous) <= 0,
                                "CPW rose at score " + score + " for " + category + " @ " + price);
                    }
                    previous = estimate.getCostPerWear();
                    previousWears = estimate.getEstimatedWears();
                }
            }
        }
    }

    @Test
    void verdict_usesConfiguredBands() {
        assertEquals(Verdict.EXCELLENT_VALUE, estimator.verdict(90, config));
        assertEquals(Verdict.FAIR, estimator.verdict(60, config));
        assertEquals(Verdict.RECONSIDER, estimator.verdict(10, config));
        assertEquals("excellent value potential", Verdict.EXCELLENT_VALUE.getLabel());

        ScoringConfig lenient = ScoringConfig.fromMap(Map.of(ScoringConfig.VERDICT_FAIR_FLOOR, 5.0));
        assertEquals(Verdict.FAIR, estimator.verdict(10, lenient));
    }

    @Test
    void multiplierRange_isConfigurable() {
        ScoringConfig wide = ScoringConfig.fromMap(Map.of(
                ScoringConfig.MULTIPLIER_MIN, 1.0,
                ScoringConfig.MULTIPLIER_MAX, 3.0));

        assertEquals(300, estimator.estimate(jeans, 100, 30.0, wide).getEstimatedWears());
        assertEquals(100, estimator.estimate(jeans, 0, 30.0, wide).getEstimatedWears());
    }
}
