package org.cleanseam.engine.domain.service;

import org.cleanseam.engine.domain.model.CategoryProfile;
import org.cleanseam.engine.domain.model.ScoringConfig;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores an unknown brand by how its price compares to the category reference price.
 *
 * <pre>
 *   score = center + ((price - reference_price) / reference_price) * slope
 * </pre>
 *
 * Pricier items land above the center, cheaper ones below.
 */
public final class PriceRatioFallback implements FallbackBaselineStrategy {

    public static final String TERM_CENTER = "fallback_center";
    public static final String TERM_PRICE_RATIO = "price_ratio";

    @Override
    public Map<String, Double> contributions(CategoryProfile category, double price, ScoringConfig config) {
        double reference = category.getReferencePrice();
        double ratio = (price - reference) / reference;

        Map<String, Double> terms = new LinkedHashMap<>();
        terms.put(TERM_CENTER, config.getFallbackCenter());
        terms.put(TERM_PRICE_RATIO, ratio * config.getFallbackSlope());
        return terms;
    }
}
