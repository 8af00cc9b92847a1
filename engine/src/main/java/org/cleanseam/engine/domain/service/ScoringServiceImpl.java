package org.cleanseam.engine.domain.service;

import org.cleanseam.engine.catalog.Catalog;
import org.cleanseam.engine.domain.model.BrandProfile;
import org.cleanseam.engine.domain.model.CategoryProfile;
import org.cleanseam.engine.domain.model.ScoreOutcome;
import org.cleanseam.engine.domain.model.ScoringConfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Implementation of ScoringService using an additive brand profile score.
 *
 * Score formula for catalog brands (higher = better):
 *   score = quality_baseline
 *         + category_override
 *         + w_d * durability_rating
 *         + w_t * transparency_score
 *
 * Brands missing from the catalog are scored by a {@link FallbackBaselineStrategy}.
 * Either way the sum is clamped to [0, 100] and rounded half-up.
 */
public final class ScoringServiceImpl implements ScoringService {

    private static final Logger LOG = Logger.getLogger(ScoringServiceImpl.class.getName());

    public static final String TERM_BASELINE = "quality_baseline";
    public static final String TERM_CATEGORY_OVERRIDE = "category_override";
    public static final String TERM_DURABILITY = "durability";
    public static final String TERM_TRANSPARENCY = "transparency";

    private final FallbackBaselineStrategy fallback;

    public ScoringServiceImpl() {
        this(new PriceRatioFallback());
    }

    public ScoringServiceImpl(FallbackBaselineStrategy fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
    }

    @Override
    public ScoreOutcome score(BrandProfile brand, CategoryProfile category, double price, ScoringConfig config) {
        if (brand == null) {
            Map<String, Double> terms = fallback.contributions(category, price, config);
            int score = toScore(terms);
            LOG.fine(() -> String.format("Fallback score for %s at %.2f: %d %s",
                    category.getItemType(), price, score, terms));
            return new ScoreOutcome(score, true, terms);
        }

        Map<String, Double> terms = new LinkedHashMap<>();
        terms.put(TERM_BASELINE, brand.getQualityBaseline());
        terms.put(TERM_CATEGORY_OVERRIDE,
                brand.getCategoryOverride(Catalog.normalizeKey(category.getItemType())));
        terms.put(TERM_DURABILITY, config.getDurabilityWeight() * brand.getDurabilityRating());
        terms.put(TERM_TRANSPARENCY, config.getTransparencyWeight() * brand.getTransparencyScore());

        int score = toScore(terms);
        LOG.fine(() -> String.format("Scored %s for %s: %d %s",
                brand.getName(), category.getItemType(), score, terms));
        return new ScoreOutcome(score, false, terms);
    }

    private static int toScore(Map<String, Double> terms) {
        double sum = 0.0;
        for (double term : terms.values()) {
            sum += term;
        }
        return (int) Math.round(clamp(sum));
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }
}
