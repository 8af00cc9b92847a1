package org.cleanseam.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Error body returned for rejected requests.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ErrorDto {

    @JsonProperty("error")
    private final String error;

    @JsonProperty("error_kind")
    private final String errorKind;

    @JsonProperty("failed")
    private final List<ComparisonResultDto.FailureDto> failed;

    public ErrorDto(String error, String errorKind) {
        this(error, errorKind, null);
    }

    public ErrorDto(String error, String errorKind, List<ComparisonResultDto.FailureDto> failed) {
        this.error = error;
        this.errorKind = errorKind;
        this.failed = failed;
    }
}
