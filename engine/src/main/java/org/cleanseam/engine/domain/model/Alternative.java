package org.cleanseam.engine.domain.model;

/**
 * A catalog brand that scores meaningfully better in the analyzed category.
 */
public final class Alternative {

    private final String brand;
    private final int qualityScore;
    private final String typicalPriceRange;

    public Alternative(String brand, int qualityScore, String typicalPriceRange) {
        this.brand = brand;
        this.qualityScore = qualityScore;
        this.typicalPriceRange = typicalPriceRange;
    }

    public String getBrand() {
        return brand;
    }

    public int getQualityScore() {
        return qualityScore;
    }

    public String getTypicalPriceRange() {
        return typicalPriceRange;
    }

    @Override
    public String toString() {
        return "Alternative{" + brand + ", score=" + qualityScore + "}";
    }
}
