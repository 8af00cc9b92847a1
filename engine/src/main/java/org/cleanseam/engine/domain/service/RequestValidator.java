package org.cleanseam.engine.domain.service;

import org.cleanseam.engine.catalog.Catalog;
import org.cleanseam.engine.catalog.CatalogStore;
import org.cleanseam.engine.domain.exception.AnalysisException;
import org.cleanseam.engine.domain.model.AnalysisInput;
import org.cleanseam.engine.domain.model.AnalysisRequest;
import org.cleanseam.engine.domain.model.CategoryProfile;
import org.cleanseam.engine.domain.model.ErrorKind;

import java.math.BigDecimal;
import java.util.logging.Logger;

/**
 * Normalizes raw input and rejects bad prices and unknown categories.
 * Unknown brands pass through; scoring handles them with the fallback heuristic.
 */
public final class RequestValidator {

    private static final Logger LOG = Logger.getLogger(RequestValidator.class.getName());

    static final String UNKNOWN_BRAND = "Unknown";

    public AnalysisRequest validate(AnalysisInput input, CatalogStore catalog) {
        CategoryProfile category = catalog.lookupCategory(input.getItemType())
                .orElseThrow(() -> new AnalysisException(ErrorKind.UNKNOWN_CATEGORY,
                        "Unknown item type: " + input.getItemType()));
        double price = parsePrice(input.getPrice());

        String submitted = input.getBrand() == null ? "" : input.getBrand().trim();
        if (submitted.isEmpty()) {
            submitted = UNKNOWN_BRAND;
        }
        String brandKey = Catalog.normalizeKey(submitted);

        LOG.fine(() -> String.format("Validated brand=%s itemType=%s price=%.2f",
                brandKey, category.getItemType(), price));
        return new AnalysisRequest(brandKey, submitted, category, price, input.getCurrency());
    }

    private static double parsePrice(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new AnalysisException(ErrorKind.INVALID_PRICE, "Price is required");
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new AnalysisException(ErrorKind.INVALID_PRICE, "Price is not a number: " + raw);
        }
        double price = parsed.doubleValue();
        if (parsed.signum() <= 0 || !(price > 0) || Double.isInfinite(price)) {
            throw new AnalysisException(ErrorKind.INVALID_PRICE, "Price must be greater than zero: " + raw);
        }
        return price;
    }
}
