package org.cleanseam.engine.domain.service;

import org.cleanseam.engine.catalog.Catalog;
import org.cleanseam.engine.catalog.CatalogStore;
import org.cleanseam.engine.domain.model.Alternative;
import org.cleanseam.engine.domain.model.AnalysisInput;
import org.cleanseam.engine.domain.model.AnalysisRequest;
import org.cleanseam.engine.domain.model.AnalysisResult;
import org.cleanseam.engine.domain.model.BrandProfile;
import org.cleanseam.engine.domain.model.CategoryProfile;
import org.cleanseam.engine.domain.model.QualityBand;
import org.cleanseam.engine.domain.model.ScoreOutcome;
import org.cleanseam.engine.domain.model.ScoringConfig;
import org.cleanseam.engine.domain.model.Verdict;
import org.cleanseam.engine.domain.model.WearEstimate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Implementation of AnalysisService.
 * Each call works on one catalog snapshot: validate, score, estimate, finalize.
 */
public final class AnalysisServiceImpl implements AnalysisService {

    private static final Logger LOG = Logger.getLogger(AnalysisServiceImpl.class.getName());

    private final CatalogStore catalogStore;
    private final RequestValidator validator;
    private final ScoringService scoringService;
    private final WearEstimator wearEstimator;

    public AnalysisServiceImpl(CatalogStore catalogStore, RequestValidator validator,
                               ScoringService scoringService, WearEstimator wearEstimator) {
        this.catalogStore = Objects.requireNonNull(catalogStore, "catalogStore must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.scoringService = Objects.requireNonNull(scoringService, "scoringService must not be null");
        this.wearEstimator = Objects.requireNonNull(wearEstimator, "wearEstimator must not be null");
    }

    @Override
    public AnalysisResult analyze(AnalysisInput input) {
        return analyze(input, catalogStore.snapshot());
    }

    @Override
    public AnalysisResult analyze(AnalysisInput input, Catalog catalog) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(catalog, "catalog must not be null");
        ScoringConfig config = catalog.getScoringConfig();

        AnalysisRequest request = validator.validate(input, catalog);
        CategoryProfile category = request.getCategory();
        BrandProfile brand = catalog.lookupBrand(request.getBrandKey()).orElse(null);

        ScoreOutcome outcome = scoringService.score(brand, category, request.getPrice(), config);
        WearEstimate estimate = wearEstimator.estimate(category, outcome.getQualityScore(), request.getPrice(), config);
        Verdict verdict = wearEstimator.verdict(outcome.getQualityScore(), config);

        AnalysisResult result = new AnalysisResult.Builder()
                .brand(brand != null ? brand.getName() : request.getSubmittedBrand())
                .itemType(category.getItemType())
                .price(request.getPrice())
                .currency(request.getCurrency())
                .score(outcome)
                .estimate(estimate)
                .verdict(verdict)
                .summary(summarize(outcome.getQualityScore(), estimate.getCostPerWear(), category, config))
                .categoryAverage(category.getAverageScore())
                .betterAlternatives(findAlternatives(catalog, brand, request, outcome.getQualityScore()))
                .build();

        LOG.fine(() -> "Analysis finalized: " + result);
        return result;
    }

    @Override
    public Catalog snapshot() {
        return catalogStore.snapshot();
    }

    @Override
    public Optional<BrandProfile> brandProfile(String name) {
        return catalogStore.lookupBrand(name);
    }

    @Override
    public List<CategoryProfile> categories() {
        return catalogStore.listCategories();
    }

    /**
     * Catalog brands scoring clearly higher in this category, best first.
     */
    private List<Alternative> findAlternatives(Catalog catalog, BrandProfile analyzed,
                                               AnalysisRequest request, int currentScore) {
        ScoringConfig config = catalog.getScoringConfig();
        double threshold = currentScore + config.getAlternativesMinMargin();

        List<Alternative> candidates = new ArrayList<>();
        for (BrandProfile candidate : catalog.listBrands()) {
            if (candidate == analyzed) {
                continue;
            }
            int score = scoringService.score(candidate, request.getCategory(), request.getPrice(), config)
                    .getQualityScore();
            if (score > threshold) {
                candidates.add(new Alternative(candidate.getName(), score,
                        candidate.getPriceTier().getTypicalPriceRange()));
            }
        }

        return candidates.stream()
                .sorted(Comparator.comparingInt(Alternative::getQualityScore).reversed()
                        .thenComparing(Alternative::getBrand, String.CASE_INSENSITIVE_ORDER))
                .limit(Math.max(0, config.getAlternativesLimit()))
                .collect(Collectors.toList());
    }

    private static String summarize(int score, BigDecimal costPerWear,
                                    CategoryProfile category, ScoringConfig config) {
        String comparison;
        double margin = config.getCategoryMargin();
        if (score < category.getAverageScore() - margin) {
            comparison = "Below average for this category.";
        } else if (score > category.getAverageScore() + margin) {
            comparison = "Above average for this category.";
        } else {
            comparison = "Average for this category.";
        }

        String valueNote;
        double cpw = costPerWear.doubleValue();
        if (cpw < config.getValueGoodCpw()) {
            valueNote = "Good value per wear.";
        } else if (cpw < config.getValueReasonableCpw()) {
            valueNote = "Reasonable value.";
        } else {
            valueNote = "Consider if you'll wear it enough to justify the cost.";
        }

        return QualityBand.forScore(score, config).getPhrase() + ". " + comparison + " " + valueNote;
    }
}
