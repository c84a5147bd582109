package com.questrail.eztest.core;

/**
 * Indicates that a test body terminated with an exception other than a
 * forced failure.
 *
 * <p>The harness provides no isolation between cases, so this is fatal to
 * the whole run: the failing case is not finalized, no further cases run and
 * no summary is printed.</p>
 */
public final class TestCaseAbortedException extends RuntimeException
{
    private final String caseName;

    public TestCaseAbortedException(String caseName, Throwable cause) {
        super("Test case '" + caseName + "' aborted: " + cause, cause);
        this.caseName = caseName;
    }

    public String caseName() {
        return caseName;
    }
}
