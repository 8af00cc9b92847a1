package org.cleanseam.engine.domain.service;

import org.cleanseam.engine.catalog.Catalog;
import org.cleanseam.engine.domain.model.AnalysisInput;
import org.cleanseam.engine.domain.model.AnalysisResult;
import org.cleanseam.engine.domain.model.BrandProfile;
import org.cleanseam.engine.domain.model.CategoryProfile;

import java.util.List;
import java.util.Optional;

/**
 * Quality and cost-per-wear analysis of single items.
 */
public interface AnalysisService {

    /**
     * Run validation, scoring and wear estimation for one item.
     *
     * @param input raw caller input
     * @return the finalized result
     * @throws org.cleanseam.engine.domain.exception.AnalysisException on an invalid price or unknown category
     */
    AnalysisResult analyze(AnalysisInput input);

    /**
     * Same as {@link #analyze(AnalysisInput)} but against a given catalog snapshot,
     * so that a batch of analyses sees one catalog.
     */
    AnalysisResult analyze(AnalysisInput input, Catalog catalog);

    /**
     * The catalog snapshot currently in use.
     */
    Catalog snapshot();

    /**
     * Look up a brand profile by name.
     */
    Optional<BrandProfile> brandProfile(String name);

    /**
     * Supported categories, alphabetical.
     */
    List<CategoryProfile> categories();
}
