package com.questrail.eztest.api;

import java.util.Objects;

/**
 * TestCaseInfo
 * -----------------------------------------------------------------------------
 * Result record of one test case invocation.
 *
 * <p>The suite runner allocates a fresh instance for every invocation and
 * hands it to the case by reference. The case populates it exactly once, on
 * normal completion or on forced failure, and the runner reads it back.</p>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code failedExpectations <= totalExpectations}</li>
 *   <li>{@code verdict == FAIL} whenever {@code failedExpectations > 0}</li>
 * </ul>
 *
 * A verdict of {@code FAIL} with zero failed expectations is legal: it is the
 * forced-failure outcome. The record also carries the state the invocation
 * finalized in; it reads {@link TestCaseState#UNSTARTED} until populated.
 */
public final class TestCaseInfo
{
    private int totalExpectations;
    private int failedExpectations;
    private Verdict verdict = Verdict.PASS;
    private TestCaseState state = TestCaseState.UNSTARTED;

    /**
     * Copies the counters of an invocation that finished normally.
     */
    public void populate(int totalExpectations, int failedExpectations, Verdict verdict) {
        populate(totalExpectations, failedExpectations, verdict, TestCaseState.FINALIZED_NORMAL);
    }

    /**
     * Copies the counters of a finished invocation into this record.
     *
     * @param state the final state the invocation reached
     * @throws IllegalArgumentException if the values break the record invariants
     * @throws IllegalStateException if this record was already populated
     */
    public void populate(int totalExpectations, int failedExpectations, Verdict verdict, TestCaseState state) {
        Objects.requireNonNull(verdict, "verdict");
        Objects.requireNonNull(state, "state");
        if (!state.isFinal()) {
            throw new IllegalArgumentException("Not a final state: " + state);
        }
        if (state == TestCaseState.FINALIZED_FORCED && verdict == Verdict.PASS) {
            throw new IllegalArgumentException("A forced failure cannot pass");
        }
        if (totalExpectations < 0 || failedExpectations < 0) {
            throw new IllegalArgumentException("Expectation counts must be non-negative");
        }
        if (failedExpectations > totalExpectations) {
            throw new IllegalArgumentException(
                    "failedExpectations (" + failedExpectations + ") exceeds totalExpectations ("
                            + totalExpectations + ")");
        }
        if (failedExpectations > 0 && verdict == Verdict.PASS) {
            throw new IllegalArgumentException("A case with failed expectations cannot pass");
        }
        if (isPopulated()) {
            throw new IllegalStateException("TestCaseInfo already populated; use a fresh record per invocation");
        }
        this.totalExpectations = totalExpectations;
        this.failedExpectations = failedExpectations;
        this.verdict = verdict;
        this.state = state;
    }

    public int totalExpectations() {
        return totalExpectations;
    }

    public int failedExpectations() {
        return failedExpectations;
    }

    public int passedExpectations() {
        return totalExpectations - failedExpectations;
    }

    public Verdict verdict() {
        return verdict;
    }

    public TestCaseState state() {
        return state;
    }

    /**
     * Returns true if the invocation ended through a forced failure.
     */
    public boolean forced() {
        return state == TestCaseState.FINALIZED_FORCED;
    }

    public boolean passed() {
        return verdict == Verdict.PASS;
    }

    /**
     * Returns true once the owning case has written its result.
     */
    public boolean isPopulated() {
        return state.isFinal();
    }

    @Override
    public String toString() {
        return verdict + "(" + passedExpectations() + "/" + totalExpectations + ")";
    }
}
