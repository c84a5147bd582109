package com.questrail.eztest.report;

import com.questrail.eztest.api.TestCaseInfo;
import com.questrail.eztest.core.RunSummary;

/**
 * No-op implementation of TestRunListener.
 */
public final class NullTestRunListener implements TestRunListener {
    public static final NullTestRunListener INSTANCE = new NullTestRunListener();

    private NullTestRunListener() {}

    @Override
    public void onSuiteStarted(int caseCount) {}

    @Override
    public void onCaseStarted(String caseName) {}

    @Override
    public void onExpectationFailed(ExpectationFailure failure) {}

    @Override
    public void onCaseFinished(String caseName, TestCaseInfo info) {}

    @Override
    public void onSuiteFinished(RunSummary summary) {}
}
