package net.littleredcomputer.gadget2sat;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Counts the steps of a long computation and logs its progress, at most once per log interval.
 * Steps may be counted from several threads.
 */
class ProgressMeter {
    private static final Logger log = LogManager.getFormatterLogger(ProgressMeter.class);
    static final int logCheckSteps = 1000;
    private final String name;
    private final AtomicLong stepCount = new AtomicLong();
    private long lastStepCount;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    ProgressMeter(String name) { this.name = name; }

    void setLogInterval(Duration interval) { logInterval = interval; }

    synchronized void start() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount.get();
    }

    synchronized void stop() {
        if (stopwatch.isRunning()) stopwatch.stop();
    }

    void step(Supplier<String> s) {
        if (stepCount.incrementAndGet() % logCheckSteps == 0) maybeReportProgress(s);
    }

    synchronized void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final long steps = stepCount.get();
        final double perSec = 1e3 * (steps - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, steps, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = steps;
    }
}
