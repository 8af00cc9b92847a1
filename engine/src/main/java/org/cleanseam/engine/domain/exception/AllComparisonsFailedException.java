package org.cleanseam.engine.domain.exception;

import org.cleanseam.engine.domain.model.ErrorKind;
import org.cleanseam.engine.domain.model.FailedComparison;

import java.util.List;

/**
 * Thrown when no entry of a comparison batch could be analyzed.
 */
public final class AllComparisonsFailedException extends AnalysisException {

    private final transient List<FailedComparison> failures;

    public AllComparisonsFailedException(List<FailedComparison> failures) {
        super(ErrorKind.ALL_COMPARISONS_FAILED,
                "All " + failures.size() + " comparison entries failed validation");
        this.failures = List.copyOf(failures);
    }

    public List<FailedComparison> getFailures() {
        return failures;
    }
}
