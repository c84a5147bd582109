package com.questrail.eztest.report;

import com.questrail.eztest.api.TestCaseInfo;
import com.questrail.eztest.core.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mirrors suite run events into SLF4J, for runs embedded in a larger
 * application whose logs are collected.
 */
public final class Slf4jTestRunListener implements TestRunListener {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTestRunListener.class);

    @Override
    public void onSuiteStarted(int caseCount) {
        log.info("Running {} test case(s)", caseCount);
    }

    @Override
    public void onCaseStarted(String caseName) {
        log.debug("Test '{}' started", caseName);
    }

    @Override
    public void onExpectationFailed(ExpectationFailure failure) {
        log.warn("Test '{}': expectation failed at {}: actual {} expected {}",
            failure.caseName(),
            failure.location(),
            failure.actual(),
            failure.expected());
    }

    @Override
    public void onCaseFinished(String caseName, TestCaseInfo info) {
        if (info.forced()) {
            log.warn("Test '{}' {} (forced failure)", caseName, ReportFormat.caseFinished(info));
        } else if (info.passed()) {
            log.info("Test '{}' {}", caseName, ReportFormat.caseFinished(info));
        } else {
            log.warn("Test '{}' {}", caseName, ReportFormat.caseFinished(info));
        }
    }

    @Override
    public void onSuiteFinished(RunSummary summary) {
        log.info("Suite finished: {} total, {} passed, {} failed",
            summary.totalCases(), summary.passedCases(), summary.failedCases());
    }
}
