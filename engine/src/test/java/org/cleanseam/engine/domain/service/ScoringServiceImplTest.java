package org.cleanseam.engine.domain.service;

import org.cleanseam.engine.TestCatalogs;
import org.cleanseam.engine.domain.model.BrandProfile;
import org.cleanseam.engine.domain.model.CategoryProfile;
import org.cleanseam.engine.domain.model.ScoreOutcome;
import org.cleanseam.engine.domain.model.ScoringConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoringServiceImplTest {

    private final ScoringService scoring = new ScoringServiceImpl();
    private final ScoringConfig config = ScoringConfig.defaults();
    private final CategoryProfile jeans = TestCatalogs.jeans();

    @Test
    void knownBrand_sumsBaselineOverrideAndWeightedSignals() {
        BrandProfile brand = TestCatalogs.brand("Acme", 60, 50, 40, Map.of("jeans", 5.0));

        ScoreOutcome outcome = scoring.score(brand, jeans, 49.99, config);

        // 60 + 5 + 0.10 * 50 + 0.05 * 40
        assertEquals(72, outcome.getQualityScore());
        assertFalse(outcome.isFallbackUsed());
        assertEquals(List.of("quality_baseline", "category_override", "durability", "transparency"),
                List.copyOf(outcome.getBreakdown().keySet()));
        assertEquals(5.0, outcome.getBreakdown().get("category_override"));
    }

    @Test
    void knownBrand_withoutOverride_usesZeroAdjustment() {
        BrandProfile brand = TestCatalogs.brand("Acme", 60, 0, 0, Map.of("coat", 9.0));

        ScoreOutcome outcome = scoring.score(brand, jeans, 10, config);

        assertEquals(60, outcome.getQualityScore());
        assertEquals(0.0, outcome.getBreakdown().get("category_override"));
    }

    @Test
    void knownBrand_priceDoesNotMatter() {
        BrandProfile brand = TestCatalogs.flatBrand("Acme", 55);
        assertEquals(scoring.score(brand, jeans, 5, config).getQualityScore(),
                scoring.score(brand, jeans, 500, config).getQualityScore());
    }

    @Test
    void knownBrand_clampsToRange() {
        BrandProfile high = TestCatalogs.brand("High", 100, 100, 100, Map.of("jeans", 20.0));
        BrandProfile low = TestCatalogs.brand("Low", 0, 0, 0, Map.of("jeans", -30.0));

        assertEquals(100, scoring.score(high, jeans, 50, config).getQualityScore());
        assertEquals(0, scoring.score(low, jeans, 50, config).getQualityScore());
    }

    @Test
    void unknownBrand_atReferencePrice_scoresCenter() {
        ScoreOutcome outcome = scoring.score(null, jeans, 50, config);

        assertEquals(40, outcome.getQualityScore());
        assertTrue(outcome.isFallbackUsed());
        assertEquals(0.0, outcome.getBreakdown().get(PriceRatioFallback.TERM_PRICE_RATIO));
    }

    @Test
    void unknownBrand_scalesWithPriceRatio() {
        assertEquals(60, scoring.score(null, jeans, 100, config).getQualityScore());
        assertEquals(30, scoring.score(null, jeans, 25, config).getQualityScore());
        // 40 + (-0.01 / 50) * 20 = 39.996
        assertEquals(40, scoring.score(null, jeans, 49.99, config).getQualityScore());
    }

    @Test
    void unknownBrand_clampsExtremePrices() {
        assertEquals(100, scoring.score(null, jeans, 5_000, config).getQualityScore());
        assertEquals(20, scoring.score(null, jeans, 0.0001, config).getQualityScore());

        ScoringConfig steep = ScoringConfig.fromMap(Map.of(ScoringConfig.FALLBACK_SLOPE, 100.0));
        assertEquals(0, scoring.score(null, jeans, 1, steep).getQualityScore());
    }

    @Test
    void unknownBrand_breakdownRecordsPriceRatioTerm() {
        Map<String, Double> breakdown = scoring.score(null, jeans, 75, config).getBreakdown();

        assertEquals(List.of("fallback_center", "price_ratio"), List.copyOf(breakdown.keySet()));
        assertEquals(10.0, breakdown.get("price_ratio"), 1e-9);
        assertFalse(breakdown.containsKey("durability"));
    }

    @Test
    void fallbackStrategy_isReplaceable() {
        ScoringService flat = new ScoringServiceImpl((category, price, cfg) -> Map.of("flat_guess", 55.0));

        ScoreOutcome outcome = flat.score(null, jeans, 10, config);

        assertEquals(55, outcome.getQualityScore());
        assertTrue(outcome.isFallbackUsed());
        assertEquals(Map.of("flat_guess", 55.0), outcome.getBreakdown());
    }

    @Test
    void fallbackCenterAndSlope_comeFromConfig() {
        ScoringConfig tuned = ScoringConfig.fromMap(Map.of(
                ScoringConfig.FALLBACK_CENTER, 50.0,
                ScoringConfig.FALLBACK_SLOPE, 10.0));

        assertEquals(60, scoring.score(null, jeans, 100, tuned).getQualityScore());
    }
}
