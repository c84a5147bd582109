package com.questrail.eztest.core;

import com.questrail.eztest.report.SourceLocation;

/**
 * Finds the test-body statement that called into the assertion engine by
 * walking the stack past the engine's own frames.
 */
final class SourceLocator
{
    private static final StackWalker WALKER = StackWalker.getInstance();

    private SourceLocator() {}

    static SourceLocation callerOf(Class<?> engine) {
        String engineName = engine.getName();
        String selfName = SourceLocator.class.getName();
        return WALKER.walk(frames -> frames
                .filter(f -> !f.getClassName().equals(engineName))
                .filter(f -> !f.getClassName().equals(selfName))
                .findFirst()
                .map(f -> new SourceLocation(f.getFileName(), f.getLineNumber()))
                .orElse(SourceLocation.UNKNOWN));
    }
}
