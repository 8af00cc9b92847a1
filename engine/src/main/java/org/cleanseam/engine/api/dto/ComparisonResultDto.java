package org.cleanseam.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.cleanseam.engine.domain.model.ComparisonResult;
import org.cleanseam.engine.domain.model.FailedComparison;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for POST /compare, also the body of a 422 when every entry failed.
 */
public final class ComparisonResultDto {

    @JsonProperty("item_type")
    private final String itemType;

    @JsonProperty("ranked")
    private final List<AnalysisResultDto> ranked;

    @JsonProperty("failed")
    private final List<FailureDto> failed;

    @JsonProperty("recommendation")
    private final String recommendation;

    private ComparisonResultDto(String itemType, List<AnalysisResultDto> ranked, List<FailureDto> failed,
                                String recommendation) {
        this.itemType = itemType;
        this.ranked = ranked;
        this.failed = failed;
        this.recommendation = recommendation;
    }

    public static ComparisonResultDto from(ComparisonResult result) {
        return new ComparisonResultDto(
                result.getItemType(),
                result.getRanked().stream().map(AnalysisResultDto::from).collect(Collectors.toList()),
                failures(result.getFailed()),
                result.getRecommendation());
    }

    public static List<FailureDto> failures(List<FailedComparison> failed) {
        return failed.stream().map(FailureDto::new).collect(Collectors.toList());
    }

    public static final class FailureDto {
        @JsonProperty("brand")
        private final String brand;

        @JsonProperty("error_kind")
        private final String errorKind;

        @JsonProperty("message")
        private final String message;

        FailureDto(FailedComparison failure) {
            this.brand = failure.getBrand();
            this.errorKind = failure.getErrorKind().name();
            this.message = failure.getMessage();
        }
    }
}
