package com.questrail.eztest.core;

import com.questrail.eztest.api.TestCase;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * TestSuite
 * -----------------------------------------------------------------------------
 * Ordered, non-empty, immutable sequence of test cases.
 *
 * <p>Order is fixed when the suite is built and is exactly the execution
 * order. Well-written cases do not depend on it; the runner still guarantees
 * it so runs are reproducible. A case listed twice runs twice.</p>
 */
public final class TestSuite implements Iterable<TestCase>
{
    private final List<TestCase> cases;

    private TestSuite(List<TestCase> cases) {
        this.cases = List.copyOf(cases);
    }

    /**
     * Creates a suite running the given cases in argument order.
     *
     * @throws IllegalArgumentException if no cases are given
     */
    public static TestSuite of(TestCase... cases) {
        Objects.requireNonNull(cases, "cases");
        if (cases.length == 0) {
            throw new IllegalArgumentException("At least one test case is required");
        }
        Builder builder = builder();
        for (TestCase testCase : cases) {
            builder.add(testCase);
        }
        return builder.build();
    }

    public List<TestCase> cases() {
        return cases;
    }

    public int size() {
        return cases.size();
    }

    @Override
    public Iterator<TestCase> iterator() {
        return cases.iterator();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<TestCase> cases = new ArrayList<>();

        public Builder add(TestCase testCase) {
            cases.add(Objects.requireNonNull(testCase, "testCase at position " + cases.size()));
            return this;
        }

        public Builder addAll(Iterable<? extends TestCase> testCases) {
            Objects.requireNonNull(testCases, "testCases");
            for (TestCase testCase : testCases) {
                add(testCase);
            }
            return this;
        }

        public TestSuite build() {
            if (cases.isEmpty()) {
                throw new IllegalStateException("At least one test case required");
            }
            return new TestSuite(cases);
        }
    }
}
