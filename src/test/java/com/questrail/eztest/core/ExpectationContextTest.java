package com.questrail.eztest.core;

import com.questrail.eztest.api.TestCaseInfo;
import com.questrail.eztest.api.TestCaseState;
import com.questrail.eztest.api.Verdict;
import com.questrail.eztest.report.ExpectationFailure;
import com.questrail.eztest.report.RecordingTestRunListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExpectationContextTest
 * -----------------------------------------------------------------------------
 * Counting and reporting rules of the assertion engine, exercised directly
 * on a context outside of any runner.
 */
class ExpectationContextTest
{
    private RecordingTestRunListener listener;
    private ExpectationContext ctx;

    @BeforeEach
    void setUp() {
        listener = new RecordingTestRunListener();
        ctx = new ExpectationContext("engine_test", listener);
    }

    @Test
    void freshContextHasNoExpectationsAndPasses() {
        assertEquals(0, ctx.totalExpectations());
        assertEquals(0, ctx.failedExpectations());
        assertEquals(Verdict.PASS, ctx.verdict());
    }

    @Test
    void matchingValuesCountWithoutFailure() {
        ctx.expect(2 + 2, 4);

        assertEquals(1, ctx.totalExpectations());
        assertEquals(0, ctx.failedExpectations());
        assertEquals(Verdict.PASS, ctx.verdict());
        assertTrue(listener.failures().isEmpty());
    }

    @Test
    void mismatchIsRecordedAndReportedWithCallerLine() {
        int line = nextLine();
        ctx.expect(5, 6);

        assertEquals(1, ctx.totalExpectations());
        assertEquals(1, ctx.failedExpectations());
        assertEquals(Verdict.FAIL, ctx.verdict());

        ExpectationFailure failure = listener.failures().get(0);
        assertEquals("engine_test", failure.caseName());
        assertEquals(5, failure.actual());
        assertEquals(6, failure.expected());
        assertEquals(line, failure.location().lineNumber());
        assertEquals("ExpectationContextTest.java", failure.location().fileName());
    }

    @Test
    void mismatchDoesNotStopLaterExpectations() {
        ctx.expect(1, 2);
        ctx.expect(3, 3);
        ctx.expect('a', 'b');

        assertEquals(3, ctx.totalExpectations());
        assertEquals(2, ctx.failedExpectations());
        assertEquals(2, listener.failures().size());
    }

    @Test
    void verdictNeverRevertsToPass() {
        ctx.expect(1, 2);
        ctx.expect(7, 7);
        ctx.expect(8, 8);

        assertEquals(Verdict.FAIL, ctx.verdict());
    }

    @Test
    void booleanExpectationsReportOneAndZero() {
        ctx.expect(true, true);
        ctx.expect(false, true);

        assertEquals(2, ctx.totalExpectations());
        assertEquals(1, ctx.failedExpectations());
        ExpectationFailure failure = listener.failures().get(0);
        assertEquals(0, failure.actual());
        assertEquals(1, failure.expected());
    }

    @Test
    void zeroAndNotZeroReuseEqualityPath() {
        ctx.expectZero(0);
        ctx.expectNotZero(42);
        ctx.expectZero(3);
        int line = nextLine();
        ctx.expectNotZero(0);

        assertEquals(4, ctx.totalExpectations());
        assertEquals(2, ctx.failedExpectations());
        ExpectationFailure last = listener.failures().get(1);
        assertEquals(1, last.actual());
        assertEquals(0, last.expected());
        assertEquals(line, last.location().lineNumber());
    }

    @Test
    void expectSameComparesIdentityNotEquality() {
        String a = new String("eztest");
        String b = new String("eztest");

        ctx.expectSame(a, a);
        ctx.expectSame(null, null);
        ctx.expectSame(a, b);

        assertEquals(3, ctx.totalExpectations());
        assertEquals(1, ctx.failedExpectations());
        assertEquals(System.identityHashCode(a), listener.failures().get(0).actual());
    }

    @Test
    void bufferMismatchCountsOnceAndIsNotReported() {
        byte[] value = {1, 9, 3, 9};
        byte[] expected = {1, 2, 3, 4};

        ctx.expectBuf(value, expected, 4);

        assertEquals(1, ctx.totalExpectations());
        assertEquals(1, ctx.failedExpectations());
        assertEquals(Verdict.FAIL, ctx.verdict());
        assertTrue(listener.failures().isEmpty());
    }

    @Test
    void bufferComparesOnlyTheRequestedPrefix() {
        ctx.expectBuf(new byte[] {1, 2, 3}, new byte[] {1, 2, 4}, 2);

        assertEquals(1, ctx.totalExpectations());
        assertEquals(0, ctx.failedExpectations());
    }

    @Test
    void zeroSizeBufferAlwaysPasses() {
        ctx.expectBuf(new byte[] {1}, new byte[] {2}, 0);
        ctx.expectBuf((byte[]) null, null, 0);

        assertEquals(2, ctx.totalExpectations());
        assertEquals(0, ctx.failedExpectations());
        assertEquals(Verdict.PASS, ctx.verdict());
    }

    @Test
    void byteBufferComparisonStartsAtPositionAndLeavesItAlone() {
        ByteBuffer value = ByteBuffer.wrap(new byte[] {0, 0, 5, 6});
        value.position(2);
        ByteBuffer expected = ByteBuffer.wrap(new byte[] {5, 6});

        ctx.expectBuf(value, expected, 2);
        ctx.expectBuf(value, ByteBuffer.wrap(new byte[] {5, 7}), 2);

        assertEquals(2, ctx.totalExpectations());
        assertEquals(1, ctx.failedExpectations());
        assertEquals(2, value.position());
    }

    @Test
    void invalidBufferSizeIsRejectedWithoutCounting() {
        assertThrows(IllegalArgumentException.class,
                () -> ctx.expectBuf(new byte[2], new byte[2], -1));
        assertThrows(IllegalArgumentException.class,
                () -> ctx.expectBuf(new byte[2], new byte[4], 3));
        assertEquals(0, ctx.totalExpectations());
    }

    @Test
    void invalidByteBufferSizeIsRejectedAgainstRemaining() {
        ByteBuffer value = ByteBuffer.wrap(new byte[4]);
        value.position(2);
        ByteBuffer expected = ByteBuffer.wrap(new byte[4]);

        assertThrows(IllegalArgumentException.class, () -> ctx.expectBuf(value, expected, -1));
        assertThrows(IllegalArgumentException.class, () -> ctx.expectBuf(value, expected, 3));
        assertEquals(0, ctx.totalExpectations());
    }

    @Test
    void zeroSizeByteBufferAlwaysPasses() {
        ctx.expectBuf((ByteBuffer) null, null, 0);

        assertEquals(1, ctx.totalExpectations());
        assertEquals(0, ctx.failedExpectations());
    }

    @Test
    void forceFailSetsVerdictAndExitsThroughSignal() {
        ctx.expect(1, 1);

        assertThrows(ForcedFailureSignal.class, () -> ctx.forceFail());
        assertEquals(Verdict.FAIL, ctx.verdict());
        assertEquals(1, ctx.totalExpectations());
        assertEquals(0, ctx.failedExpectations());
    }

    @Test
    void lifecycleMovesThroughStates() {
        assertEquals(TestCaseState.UNSTARTED, ctx.state());
        ctx.begin();
        assertEquals(TestCaseState.RUNNING, ctx.state());
        ctx.finish(true);
        assertEquals(TestCaseState.FINALIZED_FORCED, ctx.state());

        assertThrows(IllegalStateException.class, () -> ctx.begin());
        assertThrows(IllegalStateException.class, () -> ctx.finish(false));
    }

    @Test
    void copyToRequiresFinishedInvocation() {
        ctx.begin();

        assertThrows(IllegalStateException.class, () -> ctx.copyTo(new TestCaseInfo()));
    }

    @Test
    void copyToPopulatesRecord() {
        ctx.begin();
        ctx.expect(1, 1);
        ctx.expect(1, 2);
        ctx.finish(false);
        TestCaseInfo info = new TestCaseInfo();

        ctx.copyTo(info);

        assertEquals(2, info.totalExpectations());
        assertEquals(1, info.failedExpectations());
        assertEquals(1, info.passedExpectations());
        assertEquals(Verdict.FAIL, info.verdict());
        assertEquals(TestCaseState.FINALIZED_NORMAL, info.state());
    }

    /**
     * Line number of the statement following the caller.
     */
    private static int nextLine() {
        return StackWalker.getInstance()
                .walk(frames -> frames.skip(1).findFirst())
                .orElseThrow()
                .getLineNumber() + 1;
    }
}
