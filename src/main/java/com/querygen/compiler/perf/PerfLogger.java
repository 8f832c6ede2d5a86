package com.querygen.compiler.perf;

import java.time.Duration;

/**
 * Sink for stage timings. Implementations must be thread-safe and must never throw.
 */
public interface PerfLogger {

    void record(String label, Duration elapsed);

    default TimingSpan start(String label) {
        return new TimingSpan(label, this, System::nanoTime);
    }

    /**
     * Discards every timing.
     */
    static PerfLogger noop() {
        return (label, elapsed) -> { };
    }
}
