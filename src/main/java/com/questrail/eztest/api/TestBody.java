package com.questrail.eztest.api;

/**
 * The user-supplied statements of a test case.
 *
 * <p>The body runs once per suite run, in source order, with the case's
 * private {@link Expectations} in scope. Anything the body acquires it must
 * release itself; the harness performs no cleanup.</p>
 */
@FunctionalInterface
public interface TestBody
{
    void run(Expectations expect) throws Exception;
}
