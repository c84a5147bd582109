package com.questrail.eztest.api;

/**
 * Verdict
 * -----------------------------------------------------------------------------
 * The pass/fail outcome of a single test case.
 *
 * <p>A case starts out {@link #PASS}. It becomes {@link #FAIL} on the first
 * failing expectation or on a forced failure, and never reverts to
 * {@code PASS} within the same invocation. A case that evaluates no
 * expectations at all passes.</p>
 */
public enum Verdict
{
    PASS,

    FAIL;

    /**
     * Word used for this verdict in the console report.
     */
    public String reportWord()
    {
        return this == PASS ? "PASSED" : "FAILED";
    }
}
