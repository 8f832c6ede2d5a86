package com.querygen.compiler.perf;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs each finished span at debug level.
 */
public class Slf4jPerfLogger implements PerfLogger {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPerfLogger.class);

    @Override
    public void record(String label, Duration elapsed) {
        log.debug("{} took {}ms", label, elapsed.toMillis());
    }
}
