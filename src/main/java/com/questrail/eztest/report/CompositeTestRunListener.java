package com.questrail.eztest.report;

import com.questrail.eztest.api.TestCaseInfo;
import com.questrail.eztest.core.RunSummary;

import java.util.List;
import java.util.Objects;

/**
 * Forwards every event to each delegate, in list order.
 */
public final class CompositeTestRunListener implements TestRunListener {
    private final List<TestRunListener> delegates;

    public CompositeTestRunListener(List<TestRunListener> delegates) {
        Objects.requireNonNull(delegates, "delegates");
        for (int i = 0; i < delegates.size(); i++) {
            Objects.requireNonNull(delegates.get(i), "listener at index " + i);
        }
        this.delegates = List.copyOf(delegates);
    }

    public List<TestRunListener> delegates() {
        return delegates;
    }

    @Override
    public void onSuiteStarted(int caseCount) {
        for (TestRunListener l : delegates) {
            l.onSuiteStarted(caseCount);
        }
    }

    @Override
    public void onCaseStarted(String caseName) {
        for (TestRunListener l : delegates) {
            l.onCaseStarted(caseName);
        }
    }

    @Override
    public void onExpectationFailed(ExpectationFailure failure) {
        for (TestRunListener l : delegates) {
            l.onExpectationFailed(failure);
        }
    }

    @Override
    public void onCaseFinished(String caseName, TestCaseInfo info) {
        for (TestRunListener l : delegates) {
            l.onCaseFinished(caseName, info);
        }
    }

    @Override
    public void onSuiteFinished(RunSummary summary) {
        for (TestRunListener l : delegates) {
            l.onSuiteFinished(summary);
        }
    }
}
