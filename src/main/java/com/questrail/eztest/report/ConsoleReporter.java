package com.questrail.eztest.report;

import com.questrail.eztest.api.TestCaseInfo;
import com.questrail.eztest.core.RunSummary;

import java.io.PrintStream;
import java.util.Objects;

/**
 * ConsoleReporter
 * -----------------------------------------------------------------------------
 * Renders the human-readable suite report, one line per event, to a
 * {@link PrintStream}.
 *
 * <p>Each line is flushed as soon as it is written so the report stays in
 * step with whatever the test bodies print themselves.</p>
 */
public final class ConsoleReporter implements TestRunListener {
    private final PrintStream out;

    public ConsoleReporter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void onSuiteStarted(int caseCount) {}

    @Override
    public void onCaseStarted(String caseName) {
        line(ReportFormat.caseStarted(caseName));
    }

    @Override
    public void onExpectationFailed(ExpectationFailure failure) {
        line(ReportFormat.expectationFailed(failure));
    }

    @Override
    public void onCaseFinished(String caseName, TestCaseInfo info) {
        line(ReportFormat.caseFinished(info));
        line(ReportFormat.SEPARATOR);
    }

    @Override
    public void onSuiteFinished(RunSummary summary) {
        line(ReportFormat.suiteFinished(summary));
    }

    private void line(String text) {
        out.println(text);
        out.flush();
    }
}
