package org.cleanseam.engine.domain.service;

import org.cleanseam.engine.domain.model.CategoryProfile;
import org.cleanseam.engine.domain.model.ScoringConfig;

import java.util.Map;

/**
 * Heuristic quality estimate for brands with no catalog profile.
 */
@FunctionalInterface
public interface FallbackBaselineStrategy {

    /**
     * Named additive terms whose sum, clamped to [0, 100], is the fallback score.
     * The map iteration order is the order the terms are reported in.
     */
    Map<String, Double> contributions(CategoryProfile category, double price, ScoringConfig config);
}
