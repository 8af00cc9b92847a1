package org.cleanseam.engine.domain.model;

/**
 * Failure kinds surfaced to callers. An unknown brand is not one of them.
 */
public enum ErrorKind {
    INVALID_PRICE,
    UNKNOWN_CATEGORY,
    ALL_COMPARISONS_FAILED
}
