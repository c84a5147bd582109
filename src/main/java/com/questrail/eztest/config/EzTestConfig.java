package com.questrail.eztest.config;

import com.questrail.eztest.report.CompositeTestRunListener;
import com.questrail.eztest.report.ConsoleReporter;
import com.questrail.eztest.report.Slf4jTestRunListener;
import com.questrail.eztest.report.TestRunListener;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated configuration of a suite run.
 *
 * <ul>
 *   <li><b>output</b> — stream receiving the console report; UTF-8 encoded
 *       standard output ({@link #STANDARD_OUTPUT}) unless set. Any stream
 *       works, including one opened on a file.</li>
 *   <li><b>listeners</b> — extra listeners, notified after the console
 *       report.</li>
 *   <li><b>slf4jLogging</b> — also mirror run events into SLF4J.</li>
 *   <li><b>exitStatusPolicy</b> — how the failed-case count becomes an exit
 *       status; {@link ExitStatusPolicy#SATURATED} unless set.</li>
 * </ul>
 */
public record EzTestConfig(
    PrintStream output,
    List<TestRunListener> listeners,
    boolean slf4jLogging,
    ExitStatusPolicy exitStatusPolicy
) {
    /**
     * Standard output encoded as UTF-8 whatever the platform charset, flushed
     * on every line.
     */
    public static final PrintStream STANDARD_OUTPUT =
        new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);

    public EzTestConfig {
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(exitStatusPolicy, "exitStatusPolicy");
        listeners = List.copyOf(Objects.requireNonNull(listeners, "listeners"));
    }

    public static EzTestConfig defaults() {
        return builder().build();
    }

    /**
     * Assembles the listener a runner reports to: the console reporter first,
     * then the configured listeners, then SLF4J logging when enabled.
     */
    public TestRunListener createListener() {
        List<TestRunListener> all = new ArrayList<>();
        all.add(new ConsoleReporter(output));
        all.addAll(listeners);
        if (slf4jLogging) {
            all.add(new Slf4jTestRunListener());
        }
        return new CompositeTestRunListener(all);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private PrintStream output = STANDARD_OUTPUT;
        private final List<TestRunListener> listeners = new ArrayList<>();
        private boolean slf4jLogging = false;
        private ExitStatusPolicy exitStatusPolicy = ExitStatusPolicy.SATURATED;

        public Builder withOutput(PrintStream output) {
            this.output = output;
            return this;
        }

        public Builder addListener(TestRunListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Builder withSlf4jLogging(boolean enabled) {
            this.slf4jLogging = enabled;
            return this;
        }

        public Builder withExitStatusPolicy(ExitStatusPolicy exitStatusPolicy) {
            this.exitStatusPolicy = exitStatusPolicy;
            return this;
        }

        public EzTestConfig build() {
            return new EzTestConfig(output, listeners, slf4jLogging, exitStatusPolicy);
        }
    }
}
