package com.questrail.eztest.core;

/**
 * Non-local exit raised by {@link ExpectationContext#forceFail()} and caught
 * only by the epilogue of {@link DeclaredTestCase}.
 *
 * <p>An {@link Error} so that a body's {@code catch (Exception e)} cannot
 * intercept it. Carries no stack trace; it is control flow, not a fault.</p>
 */
final class ForcedFailureSignal extends Error
{
    ForcedFailureSignal(String caseName) {
        super("Forced failure in test '" + caseName + "'", null, false, false);
    }
}
