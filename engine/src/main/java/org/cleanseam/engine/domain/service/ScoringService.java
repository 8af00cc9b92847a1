package org.cleanseam.engine.domain.service;

import org.cleanseam.engine.domain.model.BrandProfile;
import org.cleanseam.engine.domain.model.CategoryProfile;
import org.cleanseam.engine.domain.model.ScoreOutcome;
import org.cleanseam.engine.domain.model.ScoringConfig;

/**
 * Service for calculating the 0-100 quality score of an item.
 */
public interface ScoringService {

    /**
     * Calculate the quality score for a brand in a category.
     * Higher score = better quality.
     *
     * @param brand the catalog profile, or null when the brand is not in the catalog
     * @param category the validated category
     * @param price the submitted price, used only by the fallback path
     * @param config the scoring configuration
     * @return score with the terms that produced it
     */
    ScoreOutcome score(BrandProfile brand, CategoryProfile category, double price, ScoringConfig config);
}
