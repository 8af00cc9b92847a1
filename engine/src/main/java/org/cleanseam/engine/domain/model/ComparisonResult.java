package org.cleanseam.engine.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Ranked successes plus the entries that failed, in submission order.
 */
public final class ComparisonResult {

    private final String itemType;
    private final List<AnalysisResult> ranked;
    private final List<FailedComparison> failed;
    private final String recommendation;

    public ComparisonResult(String itemType, List<AnalysisResult> ranked, List<FailedComparison> failed,
                            String recommendation) {
        this.itemType = itemType;
        this.ranked = List.copyOf(ranked);
        this.failed = List.copyOf(failed);
        this.recommendation = Objects.requireNonNull(recommendation, "recommendation must not be null");
    }

    public String getItemType() {
        return itemType;
    }

    public List<AnalysisResult> getRanked() {
        return ranked;
    }

    public List<FailedComparison> getFailed() {
        return failed;
    }

    public String getRecommendation() {
        return recommendation;
    }
}
