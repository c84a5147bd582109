package com.questrail.eztest.api;

/**
 * Lifecycle of one test case invocation.
 *
 * <pre>
 *   UNSTARTED → RUNNING → FINALIZED_NORMAL
 *                       → FINALIZED_FORCED
 * </pre>
 *
 * {@link #FINALIZED_FORCED} is reached only through a forced failure and
 * always carries a failing verdict. {@link #FINALIZED_NORMAL} carries whatever
 * the evaluated expectations produced.
 */
public enum TestCaseState
{
    UNSTARTED,

    RUNNING,

    FINALIZED_NORMAL,

    FINALIZED_FORCED;

    public boolean isFinal()
    {
        return this == FINALIZED_NORMAL || this == FINALIZED_FORCED;
    }
}
