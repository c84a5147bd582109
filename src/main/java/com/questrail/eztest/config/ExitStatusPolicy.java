package com.questrail.eztest.config;

/**
 * How the failed-case count of a run maps onto a process exit status.
 *
 * <p>Most platforms keep only the low 8 bits of an exit status, so a raw
 * count of 256 failures would read as success. {@link #SATURATED} caps the
 * status instead; {@link #RAW} keeps the count unchanged for callers that
 * consume it in-process.</p>
 */
public enum ExitStatusPolicy
{
    /** Exit status is the failed-case count as is. */
    RAW {
        @Override
        public int exitStatus(int failedCases) {
            return failedCases;
        }
    },

    /** Exit status is the failed-case count capped at {@value #MAX_STATUS}. */
    SATURATED {
        @Override
        public int exitStatus(int failedCases) {
            return Math.min(failedCases, MAX_STATUS);
        }
    };

    public static final int MAX_STATUS = 255;

    public abstract int exitStatus(int failedCases);
}
