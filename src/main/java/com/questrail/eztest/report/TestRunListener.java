package com.questrail.eztest.report;

import com.questrail.eztest.api.TestCaseInfo;
import com.questrail.eztest.core.RunSummary;

/**
 * Receives the events of a suite run, in the order they happen.
 * Implementations render text, write logs, or record events for tests.
 */
public interface TestRunListener {
    /**
     * Called once before the first case is invoked.
     * @param caseCount number of cases the suite will run
     */
    void onSuiteStarted(int caseCount);

    /**
     * Called by a case's prologue, before its body runs.
     */
    void onCaseStarted(String caseName);

    /**
     * Called for every failing scalar or identity expectation.
     * Buffer expectations report no diagnostic.
     */
    void onExpectationFailed(ExpectationFailure failure);

    /**
     * Called by the runner after reading back a populated result record.
     */
    void onCaseFinished(String caseName, TestCaseInfo info);

    /**
     * Called once after the last case.
     */
    void onSuiteFinished(RunSummary summary);
}
