package com.questrail.eztest.report;

import java.util.Objects;

/**
 * Record describing one failed scalar expectation.
 */
public record ExpectationFailure(
    String caseName,
    SourceLocation location,
    long actual,
    long expected
) {
    public ExpectationFailure {
        Objects.requireNonNull(caseName, "caseName");
        Objects.requireNonNull(location, "location");
    }
}
