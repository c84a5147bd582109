package com.questrail.eztest.api;

import com.questrail.eztest.core.DeclaredTestCase;
import com.questrail.eztest.report.TestRunListener;

/**
 * TestCase
 * -----------------------------------------------------------------------------
 * A named, self-contained unit of test logic.
 *
 * <p>A test case holds no state between invocations. Each call to
 * {@link #run} starts from fresh counters and writes its outcome into the
 * supplied {@link TestCaseInfo} before returning.</p>
 *
 * <p>Test authors normally declare cases through {@link #of}:</p>
 *
 * <pre>
 *   TestCase sumTest = TestCase.of("sum_test", expect -&gt; {
 *       int result = calculator.sum(2, 2);
 *       expect.expect(result, 4);
 *   });
 * </pre>
 */
public interface TestCase
{
    String name();

    /**
     * Invokes this case once.
     *
     * @param out      record owned by the caller, populated before returning
     * @param listener receives the start announcement and failure diagnostics
     */
    void run(TestCaseInfo out, TestRunListener listener);

    /**
     * Declares a test case whose body is wrapped with the standard prologue
     * (fresh counters, start announcement) and epilogue (copy-out).
     */
    static TestCase of(String name, TestBody body) {
        return new DeclaredTestCase(name, body);
    }
}
