package com.questrail.eztest.core;

import com.questrail.eztest.api.TestCaseInfo;
import com.questrail.eztest.config.ExitStatusPolicy;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one suite run: the result record of every case, in execution
 * order, and the counts derived from them.
 */
public record RunSummary(
    List<CaseResult> results
) {
    /**
     * Name and populated result record of one executed case.
     */
    public record CaseResult(String name, TestCaseInfo info) {
        public CaseResult {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(info, "info");
        }
    }

    public RunSummary {
        results = List.copyOf(Objects.requireNonNull(results, "results"));
    }

    public int totalCases() {
        return results.size();
    }

    public int failedCases() {
        int failed = 0;
        for (CaseResult result : results) {
            if (!result.info().passed()) {
                failed++;
            }
        }
        return failed;
    }

    public int passedCases() {
        return totalCases() - failedCases();
    }

    public boolean allPassed() {
        return failedCases() == 0;
    }

    /**
     * The aggregate outcome as a process exit status under the given policy.
     */
    public int exitStatus(ExitStatusPolicy policy) {
        return Objects.requireNonNull(policy, "policy").exitStatus(failedCases());
    }
}
