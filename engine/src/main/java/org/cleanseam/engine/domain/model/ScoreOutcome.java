package org.cleanseam.engine.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Quality score with the named terms that produced it.
 */
public final class ScoreOutcome {

    private final int qualityScore;
    private final boolean fallbackUsed;
    private final Map<String, Double> breakdown;

    public ScoreOutcome(int qualityScore, boolean fallbackUsed, Map<String, Double> breakdown) {
        if (qualityScore < 0 || qualityScore > 100) {
            throw new IllegalArgumentException("qualityScore must be within [0, 100], got " + qualityScore);
        }
        this.qualityScore = qualityScore;
        this.fallbackUsed = fallbackUsed;
        this.breakdown = Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }

    public int getQualityScore() {
        return qualityScore;
    }

    public boolean isFallbackUsed() {
        return fallbackUsed;
    }

    /**
     * Additive terms in evaluation order, before clamping and rounding.
     */
    public Map<String, Double> getBreakdown() {
        return breakdown;
    }
}
