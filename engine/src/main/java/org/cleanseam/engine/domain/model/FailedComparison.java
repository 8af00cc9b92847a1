package org.cleanseam.engine.domain.model;

import java.util.Objects;

/**
 * A comparison entry that failed validation and was left out of the ranking.
 */
public final class FailedComparison {

    private final AnalysisInput input;
    private final ErrorKind errorKind;
    private final String message;

    public FailedComparison(AnalysisInput input, ErrorKind errorKind, String message) {
        this.input = Objects.requireNonNull(input, "input must not be null");
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind must not be null");
        this.message = message;
    }

    public String getBrand() {
        return input.getBrand();
    }

    public AnalysisInput getInput() {
        return input;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "FailedComparison{brand='" + getBrand() + "', errorKind=" + errorKind + "}";
    }
}
