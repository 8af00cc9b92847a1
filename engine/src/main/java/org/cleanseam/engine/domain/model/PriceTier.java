package org.cleanseam.engine.domain.model;

import java.util.Locale;

/**
 * Retail price tier of a brand.
 */
public enum PriceTier {
    BUDGET("budget", "$15-40"),
    MID("mid", "$40-100"),
    PREMIUM("premium", "$80-250"),
    LUXURY("luxury", "$200+");

    private final String code;
    private final String typicalPriceRange;

    PriceTier(String code, String typicalPriceRange) {
        this.code = code;
        this.typicalPriceRange = typicalPriceRange;
    }

    public String getCode() {
        return code;
    }

    public String getTypicalPriceRange() {
        return typicalPriceRange;
    }

    /**
     * Resolve a tier from its catalog code.
     *
     * @throws IllegalArgumentException if the code is not one of budget, mid, premium, luxury
     */
    public static PriceTier fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (PriceTier tier : values()) {
                if (tier.code.equals(normalized)) {
                    return tier;
                }
            }
        }
        throw new IllegalArgumentException("Unknown price tier: " + code);
    }
}
