package com.questrail.eztest.api;

import java.nio.ByteBuffer;

/**
 * Expectations
 * -----------------------------------------------------------------------------
 * Assertion surface available inside a {@link TestBody}.
 *
 * <p>Every method counts as exactly one evaluated expectation. Expectations
 * are <em>soft</em>: a mismatch is recorded and reported, and the body keeps
 * running so one invocation can surface several independent failures. The
 * only construct that ends the body early is {@link #forceFail()}.</p>
 *
 * <h2>Comparison semantics</h2>
 * Comparisons are exact. Scalar expectations compare integral values
 * (every integral type and {@code char} widens to {@code long});
 * {@link #expectSame} compares references by identity. There is no
 * floating-point tolerance and no structural equality: passing a
 * {@code double} to {@link #expect(long, long)} does not compile.
 */
public interface Expectations
{
    /**
     * Expects {@code value} to equal {@code expected}. On mismatch a
     * diagnostic naming the source line, the actual value and the expected
     * value (decimal and hex) is reported.
     */
    void expect(long value, long expected);

    /**
     * Expects a predicate to have the given truth value. Reported as 1/0.
     */
    void expect(boolean value, boolean expected);

    /**
     * Expects both arguments to be the very same reference (or both null).
     *
     * <p>A mismatch reports {@link System#identityHashCode} of each side (0 for
     * null). Distinct objects may share an identity hash, so a failure line
     * can show equal actual and expected values.</p>
     */
    void expectSame(Object value, Object expected);

    /**
     * Same as {@code expect(value == 0, true)}.
     */
    void expectZero(long value);

    /**
     * Same as {@code expect(value == 0, false)}.
     */
    void expectNotZero(long value);

    /**
     * Expects the first {@code size} bytes of both arrays to match.
     *
     * <p>Counts as one expectation whatever the size. Scanning stops at the
     * first mismatching byte, which counts one failure. A {@code size} of zero
     * always passes, null arrays included. No diagnostic line is printed for
     * buffer mismatches.</p>
     *
     * @throws IllegalArgumentException if {@code size} is negative
     */
    void expectBuf(byte[] value, byte[] expected, int size);

    /**
     * {@link #expectBuf(byte[], byte[], int)} over the remaining bytes of two
     * buffers, starting at their current positions. Positions are not moved.
     */
    void expectBuf(ByteBuffer value, ByteBuffer expected, int size);

    /**
     * Marks the case failed and leaves the body immediately. Counters
     * gathered so far are kept as they are.
     *
     * <p>The exit is an {@link Error}, so {@code catch (Exception e)} in the
     * body does not stop it; catching {@code Throwable} or {@code Error}
     * does.</p>
     */
    void forceFail();
}
