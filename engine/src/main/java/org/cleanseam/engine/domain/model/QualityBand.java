package org.cleanseam.engine.domain.model;

/**
 * Quality descriptor used in the summary sentence.
 * Finer grained than {@link Verdict}; bands come from {@link ScoringConfig}.
 */
public enum QualityBand {
    EXCELLENT("Excellent quality"),
    GOOD("Good quality"),
    AVERAGE("Average quality"),
    BELOW_AVERAGE("Below average quality"),
    POOR("Poor quality");

    private final String phrase;

    QualityBand(String phrase) {
        this.phrase = phrase;
    }

    public String getPhrase() {
        return phrase;
    }

    public static QualityBand forScore(int qualityScore, ScoringConfig config) {
        if (qualityScore >= config.getQualityExcellentFloor()) {
            return EXCELLENT;
        }
        if (qualityScore >= config.getQualityGoodFloor()) {
            return GOOD;
        }
        if (qualityScore >= config.getQualityAverageFloor()) {
            return AVERAGE;
        }
        if (qualityScore >= config.getQualityBelowAverageFloor()) {
            return BELOW_AVERAGE;
        }
        return POOR;
    }
}
