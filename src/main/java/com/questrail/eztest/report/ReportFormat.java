package com.questrail.eztest.report;

import com.questrail.eztest.api.TestCaseInfo;
import com.questrail.eztest.core.RunSummary;

import java.util.Locale;

/**
 * ReportFormat
 * -----------------------------------------------------------------------------
 * The exact text of every console report line.
 *
 * <p>These strings are what users grep for and what other tooling may scrape,
 * so they are kept in one place and covered by tests. Lines are returned
 * without a terminator.</p>
 *
 * <pre>
 *   Executing test 'sum_test'...
 *   Failed expectation. Line: 42. actual: 5(0x5) expected: 6(0x6)
 *   FAILED (0/1)
 *   --------------------------------------------------------------------------------
 *   Executed tests: 2 (1 passed, 1 failed).
 * </pre>
 */
public final class ReportFormat
{
    public static final int SEPARATOR_WIDTH = 80;

    public static final String SEPARATOR = "-".repeat(SEPARATOR_WIDTH);

    private ReportFormat() {}

    public static String caseStarted(String caseName) {
        return "Executing test '" + caseName + "'...";
    }

    /**
     * Hex is the two's complement of the 64-bit value, lowercase, no padding.
     */
    public static String expectationFailed(ExpectationFailure failure) {
        return String.format(Locale.ROOT,
                "Failed expectation. Line: %d. actual: %d(0x%x) expected: %d(0x%x)",
                failure.location().lineNumber(),
                failure.actual(), failure.actual(),
                failure.expected(), failure.expected());
    }

    public static String caseFinished(TestCaseInfo info) {
        return info.verdict().reportWord()
                + " (" + info.passedExpectations() + "/" + info.totalExpectations() + ")";
    }

    public static String suiteFinished(RunSummary summary) {
        return String.format(Locale.ROOT, "Executed tests: %d (%d passed, %d failed).",
                summary.totalCases(), summary.passedCases(), summary.failedCases());
    }
}
