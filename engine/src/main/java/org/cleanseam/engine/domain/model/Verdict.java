package org.cleanseam.engine.domain.model;

/**
 * Display verdict derived from the quality score bands in {@link ScoringConfig}.
 * Not used for ranking.
 */
public enum Verdict {
    EXCELLENT_VALUE("excellent value potential"),
    FAIR("fair"),
    RECONSIDER("reconsider");

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Verdict forScore(int qualityScore, ScoringConfig config) {
        if (qualityScore >= config.getVerdictExcellentFloor()) {
            return EXCELLENT_VALUE;
        }
        if (qualityScore >= config.getVerdictFairFloor()) {
            return FAIR;
        }
        return RECONSIDER;
    }
}
