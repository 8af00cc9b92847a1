package org.cleanseam.engine.catalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.cleanseam.engine.api.dto.CatalogDto;
import org.cleanseam.engine.domain.model.BrandProfile;
import org.cleanseam.engine.domain.model.CategoryProfile;
import org.cleanseam.engine.domain.model.PriceTier;
import org.cleanseam.engine.domain.model.ScoringConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Parses catalog JSON documents into validated {@link Catalog} snapshots.
 */
public final class CatalogLoader {

    private static final Logger LOG = Logger.getLogger(CatalogLoader.class.getName());

    public static final String DEFAULT_RESOURCE = "catalog.json";

    private final ObjectMapper mapper;

    public CatalogLoader() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    }

    /**
     * Source that reads a catalog from the classpath on every load.
     */
    public CatalogSource classpathSource(String resource) {
        return () -> {
            try (InputStream in = CatalogLoader.class.getClassLoader().getResourceAsStream(resource)) {
                if (in == null) {
                    throw new CatalogLoadException("Catalog resource not found on classpath: " + resource);
                }
                return parse(in, "classpath:" + resource);
            } catch (IOException e) {
                throw new CatalogLoadException("Failed to read catalog resource " + resource, e);
            }
        };
    }

    /**
     * Source that reads a catalog file on every load.
     */
    public CatalogSource fileSource(Path path) {
        return () -> {
            if (!Files.isRegularFile(path)) {
                throw new CatalogLoadException("Catalog file not found: " + path.toAbsolutePath());
            }
            try (InputStream in = Files.newInputStream(path)) {
                return parse(in, path.toString());
            } catch (IOException e) {
                throw new CatalogLoadException("Failed to read catalog file " + path, e);
            }
        };
    }

    /**
     * Parse a catalog document.
     *
     * @param origin where the document came from, for error messages
     * @throws CatalogLoadException if the JSON is malformed or any entry is invalid
     */
    public Catalog parse(InputStream in, String origin) {
        CatalogDto dto;
        try {
            dto = mapper.readValue(in, CatalogDto.class);
        } catch (IOException e) {
            throw new CatalogLoadException("Malformed catalog JSON in " + origin + ": " + e.getMessage(), e);
        }
        if (dto == null) {
            throw new CatalogLoadException("Empty catalog document: " + origin);
        }

        ScoringConfig config = toScoringConfig(dto.getConfig(), origin);
        List<CategoryProfile> categories = new ArrayList<>();
        for (CatalogDto.CategoryDto category : nonNull(dto.getCategories())) {
            categories.add(toCategory(category, origin));
        }
        List<BrandProfile> brands = new ArrayList<>();
        for (CatalogDto.BrandDto brand : nonNull(dto.getBrands())) {
            brands.add(toBrand(brand, origin));
        }
        if (categories.isEmpty()) {
            throw new CatalogLoadException("Catalog " + origin + " defines no categories");
        }

        Catalog catalog = Catalog.of(brands, categories, config);
        LOG.info(() -> String.format("Parsed %s from %s", catalog, origin));
        return catalog;
    }

    private ScoringConfig toScoringConfig(List<CatalogDto.ConfigItemDto> items, String origin) {
        Map<String, Double> overrides = new HashMap<>();
        for (CatalogDto.ConfigItemDto item : nonNull(items)) {
            if (item.getKey() == null || item.getValue() == null) {
                throw new CatalogLoadException("Config entry in " + origin + " needs both key and value");
            }
            overrides.put(item.getKey(), item.getValue());
        }
        try {
            ScoringConfig config = ScoringConfig.fromMap(overrides);
            if (!overrides.isEmpty()) {
                LOG.info(() -> "Loaded " + overrides.size() + " scoring config overrides");
            }
            return config;
        } catch (IllegalArgumentException e) {
            throw new CatalogLoadException("Invalid scoring config in " + origin + ": " + e.getMessage(), e);
        }
    }

    private CategoryProfile toCategory(CatalogDto.CategoryDto dto, String origin) {
        String itemType = require(dto.getItemType(), "item_type", "category", origin);
        Integer baseWears = require(dto.getBaseWearCount(), "base_wear_count", itemType, origin);
        Double referencePrice = require(dto.getReferencePrice(), "reference_price", itemType, origin);
        int lifespan = dto.getBaseLifespanMonths() != null
                ? dto.getBaseLifespanMonths() : CategoryProfile.DEFAULT_LIFESPAN_MONTHS;
        double average = dto.getAverageScore() != null
                ? dto.getAverageScore() : CategoryProfile.DEFAULT_AVERAGE_SCORE;
        return new CategoryProfile(Catalog.normalizeKey(itemType), baseWears, referencePrice, lifespan, average);
    }

    private BrandProfile toBrand(CatalogDto.BrandDto dto, String origin) {
        String name = require(dto.getName(), "name", "brand", origin);
        PriceTier tier;
        try {
            tier = PriceTier.fromCode(dto.getPriceTier());
        } catch (IllegalArgumentException e) {
            throw new CatalogLoadException("Brand " + name + " in " + origin + ": " + e.getMessage(), e);
        }

        Map<String, Double> overrides = new HashMap<>();
        if (dto.getCategoryOverrides() != null) {
            dto.getCategoryOverrides().forEach((category, adjustment) -> {
                if (adjustment == null) {
                    throw new CatalogLoadException("Brand " + name + " has a null override for " + category);
                }
                overrides.put(Catalog.normalizeKey(category), adjustment);
            });
        }

        return new BrandProfile.Builder()
                .name(name.trim())
                .qualityBaseline(require(dto.getQualityBaseline(), "quality_baseline", name, origin))
                .durabilityRating(require(dto.getDurabilityRating(), "durability_rating", name, origin))
                .transparencyScore(require(dto.getTransparencyScore(), "transparency_score", name, origin))
                .priceTier(tier)
                .categoryOverrides(overrides)
                .aliases(dto.getAliases())
                .description(dto.getDescription())
                .build();
    }

    private static <T> T require(T value, String field, String owner, String origin) {
        if (value == null) {
            throw new CatalogLoadException(String.format("Missing %s for %s in %s", field, owner, origin));
        }
        return value;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }
}
