package org.cleanseam.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Request body for POST /compare: one item type and price shared by several brands.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CompareRequestDto {

    @JsonProperty("item_type")
    private String itemType;

    @JsonProperty("price")
    private JsonNode price;

    @JsonProperty("brands")
    private List<String> brands;

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

    public String getPriceText() {
        return AnalyzeRequestDto.priceText(price);
    }

    public List<String> getBrands() {
        return brands;
    }

    public void setBrands(List<String> brands) {
        this.brands = brands;
    }
}
