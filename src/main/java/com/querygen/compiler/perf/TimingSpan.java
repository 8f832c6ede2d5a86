package com.querygen.compiler.perf;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * A started timing scope. Reports to its {@link PerfLogger} exactly once, on the first {@link #stop()}
 * or {@link #close()}.
 *
 * <pre>{@code
 * try (TimingSpan span = perfLogger.start("build_ir web")) {
 *     ...
 * }
 * }</pre>
 */
public final class TimingSpan implements AutoCloseable {

    private final String label;
    private final PerfLogger sink;
    private final LongSupplier nanoClock;
    private final long startNanos;
    private final AtomicBoolean stopped = new AtomicBoolean();

    TimingSpan(String label, PerfLogger sink, LongSupplier nanoClock) {
        this.label = label;
        this.sink = sink;
        this.nanoClock = nanoClock;
        this.startNanos = nanoClock.getAsLong();
    }

    public String getLabel() {
        return label;
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * Stop the span and report it. Later calls are no-ops.
     */
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            sink.record(label, Duration.ofNanos(nanoClock.getAsLong() - startNanos));
        }
    }

    @Override
    public void close() {
        stop();
    }
}
