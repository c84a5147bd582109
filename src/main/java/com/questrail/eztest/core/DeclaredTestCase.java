package com.questrail.eztest.core;

import com.questrail.eztest.api.TestBody;
import com.questrail.eztest.api.TestCase;
import com.questrail.eztest.api.TestCaseInfo;
import com.questrail.eztest.report.TestRunListener;

import java.util.Objects;

/**
 * DeclaredTestCase
 * -----------------------------------------------------------------------------
 * A {@link TestCase} built from a name and a {@link TestBody}, wrapped with
 * the implicit prologue and epilogue every declared case shares.
 *
 * <h2>Prologue</h2>
 * Fresh {@link ExpectationContext} (zero counters, verdict PASS), the start
 * announcement, then UNSTARTED → RUNNING.
 *
 * <h2>Epilogue</h2>
 * On normal fall-through, and on forced failure, the context is finalized and
 * its counters and final state are copied into the runner's
 * {@link TestCaseInfo}. Any other exception from the
 * body skips the epilogue and surfaces as a {@link TestCaseAbortedException}.
 */
public final class DeclaredTestCase implements TestCase
{
    private final String name;
    private final TestBody body;

    public DeclaredTestCase(String name, TestBody body) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Test case name must not be blank");
        }
        this.name = name;
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void run(TestCaseInfo out, TestRunListener listener) {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(listener, "listener");

        ExpectationContext context = new ExpectationContext(name, listener);
        listener.onCaseStarted(name);
        context.begin();

        boolean forced;
        try {
            body.run(context);
            forced = false;
        } catch (ForcedFailureSignal signal) {
            forced = true;
        } catch (Exception e) {
            throw new TestCaseAbortedException(name, e);
        }

        context.finish(forced);
        context.copyTo(out);
    }

    @Override
    public String toString() {
        return "TestCase(" + name + ")";
    }
}
