package org.cleanseam.engine.catalog;

import org.cleanseam.engine.domain.model.BrandProfile;
import org.cleanseam.engine.domain.model.CategoryProfile;
import org.cleanseam.engine.domain.model.ScoringConfig;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Catalog store that can be reloaded from its source.
 * A reload builds a full new snapshot and swaps it in one step; readers never lock.
 */
public final class ReloadableCatalogStore implements CatalogStore {

    private static final Logger LOG = Logger.getLogger(ReloadableCatalogStore.class.getName());

    private final CatalogSource source;
    private final AtomicReference<Catalog> current;

    /**
     * Loads the initial snapshot eagerly.
     *
     * @throws CatalogLoadException if the initial load fails
     */
    public ReloadableCatalogStore(CatalogSource source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        Catalog initial = source.load();
        this.current = new AtomicReference<>(initial);
        LOG.info(() -> "Catalog loaded: " + initial);
    }

    /**
     * Replace the catalog with a fresh load from the source.
     * On failure the previous snapshot stays in place and the exception is rethrown.
     *
     * @return the snapshot now in use
     */
    public Catalog reload() {
        LOG.info("Reloading catalog...");
        Catalog fresh;
        try {
            fresh = source.load();
        } catch (CatalogLoadException e) {
            LOG.log(Level.SEVERE, "Catalog reload failed, keeping previous snapshot", e);
            throw e;
        }
        Catalog previous = current.getAndSet(fresh);
        LOG.info(() -> String.format("Catalog reloaded: %s (was %s)", fresh, previous));
        return fresh;
    }

    @Override
    public Optional<BrandProfile> lookupBrand(String name) {
        return current.get().lookupBrand(name);
    }

    @Override
    public Optional<CategoryProfile> lookupCategory(String itemType) {
        return current.get().lookupCategory(itemType);
    }

    @Override
    public List<CategoryProfile> listCategories() {
        return current.get().listCategories();
    }

    @Override
    public List<BrandProfile> listBrands() {
        return current.get().listBrands();
    }

    @Override
    public ScoringConfig getScoringConfig() {
        return current.get().getScoringConfig();
    }

    @Override
    public Catalog snapshot() {
        return current.get();
    }
}
