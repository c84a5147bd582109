package com.questrail.eztest.report;

/**
 * File and line of the test-body statement that evaluated an expectation.
 * {@code fileName} may be null when the class was compiled without debug info;
 * {@code lineNumber} is negative when unknown.
 */
public record SourceLocation(
    String fileName,
    int lineNumber
) {
    public static final SourceLocation UNKNOWN = new SourceLocation(null, -1);

    @Override
    public String toString() {
        return (fileName != null ? fileName : "<unknown>") + ":" + lineNumber;
    }
}
