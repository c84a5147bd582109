package com.questrail.eztest.core;

import com.questrail.eztest.api.TestCase;
import com.questrail.eztest.api.TestCaseInfo;
import com.questrail.eztest.config.EzTestConfig;
import com.questrail.eztest.report.TestRunListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * TestSuiteRunner
 * =============================================================================
 * Sequences the cases of a {@link TestSuite}, aggregates their results and
 * drives the report.
 *
 * <h2>Execution model</h2>
 * <ul>
 *   <li>Single-threaded and strictly sequential, in suite order.</li>
 *   <li>Every case gets a fresh {@link TestCaseInfo} and is invoked exactly
 *       once per {@link #run()}.</li>
 *   <li>No timeouts and no isolation: a case that never returns stalls the
 *       run, and a case that throws ends it.</li>
 * </ul>
 */
public final class TestSuiteRunner
{
    private static final Logger log = LoggerFactory.getLogger(TestSuiteRunner.class);

    private final TestSuite suite;
    private final TestRunListener listener;

    public TestSuiteRunner(TestSuite suite) {
        this(suite, EzTestConfig.defaults());
    }

    public TestSuiteRunner(TestSuite suite, EzTestConfig config) {
        this.suite = Objects.requireNonNull(suite, "suite");
        this.listener = Objects.requireNonNull(config, "config").createListener();
    }

    public TestSuite suite() {
        return suite;
    }

    /**
     * Runs every case once and returns the aggregated outcome.
     *
     * @throws TestCaseAbortedException if a case body throws
     * @throws IllegalStateException if a case returns without populating its result
     */
    public RunSummary run() {
        log.debug("Starting suite of {} case(s)", suite.size());
        listener.onSuiteStarted(suite.size());

        List<RunSummary.CaseResult> results = new ArrayList<>(suite.size());
        for (TestCase testCase : suite) {
            TestCaseInfo info = new TestCaseInfo();
            try {
                testCase.run(info, listener);
            } catch (RuntimeException e) {
                log.error("Test case '{}' aborted the run after {} completed case(s)",
                        testCase.name(), results.size(), e);
                throw e;
            }
            if (!info.isPopulated()) {
                throw new IllegalStateException(
                        "Test case '" + testCase.name() + "' returned without populating its result");
            }
            listener.onCaseFinished(testCase.name(), info);
            results.add(new RunSummary.CaseResult(testCase.name(), info));
        }

        RunSummary summary = new RunSummary(results);
        listener.onSuiteFinished(summary);
        log.debug("Suite finished: {} passed, {} failed", summary.passedCases(), summary.failedCases());
        return summary;
    }
}
