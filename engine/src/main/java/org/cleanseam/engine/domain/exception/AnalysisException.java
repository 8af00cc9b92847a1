package org.cleanseam.engine.domain.exception;

import org.cleanseam.engine.domain.model.ErrorKind;

import java.util.Objects;

/**
 * Rejection of an analysis or comparison request. Always a pure function of the input.
 */
public class AnalysisException extends RuntimeException {

    private final ErrorKind errorKind;

    public AnalysisException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind must not be null");
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
