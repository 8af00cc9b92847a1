package org.cleanseam.engine.domain.model;

/**
 * Raw analysis input as supplied by a caller, before validation.
 * The price is kept as text so that missing and non-numeric values can be reported.
 */
public final class AnalysisInput {

    public static final String DEFAULT_CURRENCY = "USD";

    private final String brand;
    private final String itemType;
    private final String price;
    private final String currency;

    public AnalysisInput(String brand, String itemType, String price, String currency) {
        this.brand = brand;
        this.itemType = itemType;
        this.price = price;
        this.currency = currency == null || currency.trim().isEmpty() ? DEFAULT_CURRENCY : currency.trim();
    }

    public AnalysisInput(String brand, String itemType, String price) {
        this(brand, itemType, price, DEFAULT_CURRENCY);
    }

    public AnalysisInput(String brand, String itemType, double price) {
        this(brand, itemType, Double.toString(price), DEFAULT_CURRENCY);
    }

    public String getBrand() {
        return brand;
    }

    public String getItemType() {
        return itemType;
    }

    public String getPrice() {
        return price;
    }

    public String getCurrency() {
        return currency;
    }

    @Override
    public String toString() {
        return "AnalysisInput{brand='" + brand + "', itemType='" + itemType + "', price='" + price + "'}";
    }
}
