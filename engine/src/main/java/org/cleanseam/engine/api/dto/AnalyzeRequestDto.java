package org.cleanseam.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.cleanseam.engine.domain.model.AnalysisInput;

/**
 * Request body for POST /analyze.
 * The price stays a raw JSON node so missing and non-numeric values reach validation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AnalyzeRequestDto {

    @JsonProperty("brand")
    private String brand;

    @JsonProperty("item_type")
    private String itemType;

    @JsonProperty("price")
    private JsonNode price;

    @JsonProperty("currency")
    private String currency;

    public String getBrand() {
        return brand;
    }

    public void setBrand(String brand) {
        this.brand = brand;
    }

    public String getItemType() {
        return itemType;
    }

    public void setItemType(String itemType) {
        this.itemType = itemType;
    }

    public JsonNode getPrice() {
        return price;
    }

    public void setPrice(JsonNode price) {
        this.price = price;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public AnalysisInput toInput() {
        return new AnalysisInput(brand, itemType, priceText(price), currency);
    }

    static String priceText(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.isNumber() ? node.decimalValue().toPlainString() : node.asText();
    }
}
