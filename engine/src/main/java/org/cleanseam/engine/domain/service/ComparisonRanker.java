package org.cleanseam.engine.domain.service;

import org.cleanseam.engine.catalog.Catalog;
import org.cleanseam.engine.domain.exception.AllComparisonsFailedException;
import org.cleanseam.engine.domain.exception.AnalysisException;
import org.cleanseam.engine.domain.model.AnalysisInput;
import org.cleanseam.engine.domain.model.AnalysisResult;
import org.cleanseam.engine.domain.model.ComparisonResult;
import org.cleanseam.engine.domain.model.FailedComparison;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Analyzes several brands and ranks them by value.
 *
 * Ranking order: cost-per-wear ascending, then quality score descending,
 * then brand name ascending ignoring case.
 */
public final class ComparisonRanker {

    private static final Logger LOG = Logger.getLogger(ComparisonRanker.class.getName());

    public static final Comparator<AnalysisResult> RANKING_ORDER =
            Comparator.comparing(AnalysisResult::getCostPerWear)
                    .thenComparing(Comparator.comparingInt(AnalysisResult::getQualityScore).reversed())
                    .thenComparing(AnalysisResult::getBrand, String.CASE_INSENSITIVE_ORDER)
                    .thenComparing(AnalysisResult::getBrand);

    private final AnalysisService analysisService;

    public ComparisonRanker(AnalysisService analysisService) {
        this.analysisService = Objects.requireNonNull(analysisService, "analysisService must not be null");
    }

    /**
     * Compare brands for one item type at one price.
     */
    public ComparisonResult compare(String itemType, String price, List<String> brands) {
        Objects.requireNonNull(brands, "brands must not be null");
        List<AnalysisInput> inputs = brands.stream()
                .map(brand -> new AnalysisInput(brand, itemType, price))
                .collect(Collectors.toList());
        return compare(inputs);
    }

    /**
     * Analyze every input independently and rank the successes.
     * Failed entries are reported but not ranked. All entries are analyzed
     * against the same catalog snapshot.
     *
     * @throws IllegalArgumentException if no inputs are given
     * @throws AllComparisonsFailedException if every input fails
     */
    public ComparisonResult compare(List<AnalysisInput> inputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("At least one brand is required for a comparison");
        }

        Catalog catalog = analysisService.snapshot();
        List<AnalysisResult> ranked = new ArrayList<>();
        List<FailedComparison> failed = new ArrayList<>();
        for (AnalysisInput input : inputs) {
            try {
                ranked.add(analysisService.analyze(input, catalog));
            } catch (AnalysisException e) {
                LOG.fine(() -> String.format("Comparison entry %s failed: %s", input, e.getErrorKind()));
                failed.add(new FailedComparison(input, e.getErrorKind(), e.getMessage()));
            }
        }

        if (ranked.isEmpty()) {
            LOG.warning(() -> "All " + failed.size() + " comparison entries failed");
            throw new AllComparisonsFailedException(failed);
        }

        ranked.sort(RANKING_ORDER);

        String recommendation = recommend(ranked);
        LOG.info(() -> String.format("Compared %d brands (%d failed): %s",
                inputs.size(), failed.size(), recommendation));
        return new ComparisonResult(commonItemType(inputs), ranked, failed, recommendation);
    }

    private static String recommend(List<AnalysisResult> ranked) {
        AnalysisResult best = ranked.get(0);
        if (ranked.size() == 1) {
            return best.getBrand() + " is the only brand with enough data to rank";
        }
        AnalysisResult worst = ranked.get(ranked.size() - 1);
        long improvement = Math.round(((double) best.getEstimatedWears() / worst.getEstimatedWears() - 1) * 100);
        if (improvement <= 0) {
            return best.getBrand() + " offers the lowest cost per wear";
        }
        return String.format("%s offers best value with %d%% more predicted wears", best.getBrand(), improvement);
    }

    /**
     * The normalized item type shared by all inputs, or null when they differ.
     */
    private static String commonItemType(List<AnalysisInput> inputs) {
        String first = Catalog.normalizeKey(inputs.get(0).getItemType());
        for (AnalysisInput input : inputs) {
            if (!first.equals(Catalog.normalizeKey(input.getItemType()))) {
                return null;
            }
        }
        return first;
    }
}
