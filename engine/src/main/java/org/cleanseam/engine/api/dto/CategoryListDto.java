package org.cleanseam.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.cleanseam.engine.domain.model.CategoryProfile;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for GET /categories.
 */
public final class CategoryListDto {

    @JsonProperty("categories")
    private final List<Entry> categories;

    private CategoryListDto(List<Entry> categories) {
        this.categories = categories;
    }

    public static CategoryListDto from(List<CategoryProfile> profiles) {
        return new CategoryListDto(profiles.stream().map(Entry::new).collect(Collectors.toList()));
    }

    public static final class Entry {
        @JsonProperty("item_type")
        private final String itemType;

        @JsonProperty("base_wear_count")
        private final int baseWearCount;

        @JsonProperty("reference_price")
        private final double referencePrice;

        @JsonProperty("base_lifespan_months")
        private final int baseLifespanMonths;

        @JsonProperty("average_score")
        private final double averageScore;

        Entry(CategoryProfile profile) {
            this.itemType = profile.getItemType();
            this.baseWearCount = profile.getBaseWearCount();
            this.referencePrice = profile.getReferencePrice();
            this.baseLifespanMonths = profile.getBaseLifespanMonths();
            this.averageScore = profile.getAverageScore();
        }
    }
}
