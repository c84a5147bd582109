package com.questrail.eztest.core;

import com.questrail.eztest.api.Expectations;
import com.questrail.eztest.api.TestCaseInfo;
import com.questrail.eztest.api.TestCaseState;
import com.questrail.eztest.api.Verdict;
import com.questrail.eztest.report.ExpectationFailure;
import com.questrail.eztest.report.TestRunListener;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * ExpectationContext
 * -----------------------------------------------------------------------------
 * The assertion engine: the private counters of a single test case
 * invocation, threaded through every expectation the body evaluates.
 *
 * <p>One context is created per invocation by the case prologue and is never
 * shared, so nothing a case records can leak into another case.</p>
 *
 * <h2>Counting rules</h2>
 * <ul>
 *   <li>Each expectation increments the total by exactly one.</li>
 *   <li>A mismatch increments the failed count by one and sets the verdict
 *       to {@link Verdict#FAIL}; the verdict never returns to PASS.</li>
 *   <li>Scalar and identity mismatches are reported to the listener;
 *       buffer mismatches are not.</li>
 * </ul>
 *
 * <p>The context also tracks the invocation's {@link TestCaseState}; the
 * owning case moves it through {@link #begin()} and {@link #finish(boolean)}
 * before copying it out.</p>
 */
public final class ExpectationContext implements Expectations
{
    private final String caseName;
    private final TestRunListener listener;

    private int totalExpectations;
    private int failedExpectations;
    private Verdict verdict = Verdict.PASS;
    private TestCaseState state = TestCaseState.UNSTARTED;

    public ExpectationContext(String caseName, TestRunListener listener) {
        this.caseName = Objects.requireNonNull(caseName, "caseName");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void expect(long value, long expected) {
        ++totalExpectations;
        if (value != expected) {
            recordFailure();
            listener.onExpectationFailed(new ExpectationFailure(
                    caseName, SourceLocator.callerOf(ExpectationContext.class), value, expected));
        }
    }

    @Override
    public void expect(boolean value, boolean expected) {
        expect(value ? 1L : 0L, expected ? 1L : 0L);
    }

    @Override
    public void expectSame(Object value, Object expected) {
        ++totalExpectations;
        if (value != expected) {
            recordFailure();
            listener.onExpectationFailed(new ExpectationFailure(
                    caseName, SourceLocator.callerOf(ExpectationContext.class),
                    identityOf(value), identityOf(expected)));
        }
    }

    @Override
    public void expectZero(long value) {
        expect(value == 0, true);
    }

    @Override
    public void expectNotZero(long value) {
        expect(value == 0, false);
    }

    @Override
    public void expectBuf(byte[] value, byte[] expected, int size) {
        checkSize(size);
        if (size > 0) {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(expected, "expected");
            checkBounds(size, value.length, expected.length);
        }
        ++totalExpectations;
        for (int i = 0; i < size; i++) {
            if (value[i] != expected[i]) {
                recordFailure();
                break;
            }
        }
    }

    @Override
    public void expectBuf(ByteBuffer value, ByteBuffer expected, int size) {
        checkSize(size);
        if (size > 0) {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(expected, "expected");
            checkBounds(size, value.remaining(), expected.remaining());
        }
        ++totalExpectations;
        for (int i = 0; i < size; i++) {
            if (value.get(value.position() + i) != expected.get(expected.position() + i)) {
                recordFailure();
                break;
            }
        }
    }

    @Override
    public void forceFail() {
        verdict = Verdict.FAIL;
        throw new ForcedFailureSignal(caseName);
    }

    /**
     * Moves the invocation from UNSTARTED to RUNNING.
     */
    public void begin() {
        if (state != TestCaseState.UNSTARTED) {
            throw new IllegalStateException("Cannot begin from " + state);
        }
        state = TestCaseState.RUNNING;
    }

    /**
     * Moves the invocation from RUNNING to its final state.
     *
     * @param forced true when the body ended through {@link #forceFail()}
     */
    public void finish(boolean forced) {
        if (state != TestCaseState.RUNNING) {
            throw new IllegalStateException("Cannot finish from " + state);
        }
        state = forced ? TestCaseState.FINALIZED_FORCED : TestCaseState.FINALIZED_NORMAL;
    }

    /**
     * Writes the counters and final state into the caller's result record.
     *
     * @throws IllegalStateException if the invocation has not finished
     */
    public void copyTo(TestCaseInfo out) {
        if (!state.isFinal()) {
            throw new IllegalStateException("Invocation not finished: " + state);
        }
        out.populate(totalExpectations, failedExpectations, verdict, state);
    }

    public String caseName() {
        return caseName;
    }

    public int totalExpectations() {
        return totalExpectations;
    }

    public int failedExpectations() {
        return failedExpectations;
    }

    public Verdict verdict() {
        return verdict;
    }

    public TestCaseState state() {
        return state;
    }

    private void recordFailure() {
        ++failedExpectations;
        verdict = Verdict.FAIL;
    }

    private static long identityOf(Object o) {
        return o == null ? 0L : System.identityHashCode(o);
    }

    private static void checkSize(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative: " + size);
        }
    }

    private static void checkBounds(int size, int valueLength, int expectedLength) {
        if (size > valueLength || size > expectedLength) {
            throw new IllegalArgumentException("size " + size + " exceeds buffer length (value="
                    + valueLength + ", expected=" + expectedLength + ")");
        }
    }
}
