package com.chicu.riskwatch.engine;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single-threaded cooperative scheduler: poll due tasks, run each to completion, sleep.
 * <p>
 * A task is never interrupted; {@link #stop()} takes effect at the next poll boundary.
 * A failing task is logged and rescheduled like a successful one.
 */
@Slf4j
public class MonitoringLoop {

    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration pollInterval;

    /** key → task, registration order */
    private final Map<String, Entry> tasks = new LinkedHashMap<>();

    private volatile boolean stopRequested;
    private volatile boolean running;

    private static final class Entry {
        final String key;
        final Cadence cadence;
        final Runnable action;
        Instant nextDue;

        Entry(String key, Cadence cadence, Runnable action, Instant nextDue) {
            this.key = key;
            this.cadence = cadence;
            this.action = action;
            this.nextDue = nextDue;
        }
    }

    public MonitoringLoop(Clock clock, Sleeper sleeper, Duration pollInterval) {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
        this.clock = clock;
        this.sleeper = sleeper;
        this.pollInterval = pollInterval;
    }

    // ==============================================================
    // REGISTRY
    // ==============================================================

    /**
     * Registers (or replaces) a task; first due at {@code cadence.nextAfter(now)}.
     */
    public synchronized void register(String key, Cadence cadence, Runnable action) {
        Instant first = cadence.nextAfter(clock.instant());
        tasks.put(key, new Entry(key, cadence, action, first));
        log.info("⏱ Loop: registered '{}' first due at {}", key, first);
    }

    public synchronized void cancel(String key) {
        if (tasks.remove(key) != null) {
            log.info("🛑 Loop: cancelled '{}'", key);
        }
    }

    public synchronized Optional<Instant> nextDueAt(String key) {
        Entry e = tasks.get(key);
        return e == null ? Optional.empty() : Optional.of(e.nextDue);
    }

    // ==============================================================
    // RUN
    // ==============================================================

    /**
     * Runs every task due at the current instant, earliest first, sequentially.
     *
     * @return keys of the tasks that ran
     */
    public List<String> runPending() {
        List<Entry> due;
        synchronized (this) {
            Instant now = clock.instant();
            due = new ArrayList<>();
            for (Entry e : tasks.values()) {
                if (!e.nextDue.isAfter(now)) due.add(e);
            }
        }
        due.sort(Comparator.comparing(e -> e.nextDue));

        List<String> ran = new ArrayList<>(due.size());
        for (Entry e : due) {
            try {
                log.debug("▶ Loop: running '{}'", e.key);
                e.action.run();
            } catch (RuntimeException ex) {
                log.error("❌ Loop task '{}' failed: {}", e.key, ex.getMessage(), ex);
            }
            ran.add(e.key);
            synchronized (this) {
                e.nextDue = e.cadence.nextAfter(clock.instant());
            }
        }
        return ran;
    }

    /**
     * Blocks until {@link #stop()} or interruption.
     */
    public void run() {
        running = true;
        stopRequested = false;
        log.info("🚀 Monitoring loop started (poll={})", pollInterval);
        try {
            while (!stopRequested) {
                runPending();
                if (stopRequested) break;
                sleeper.sleep(pollInterval);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Monitoring loop interrupted");
        } finally {
            running = false;
            log.info("💤 Monitoring loop stopped");
        }
    }

    public void stop() {
        stopRequested = true;
    }

    public boolean isRunning() {
        return running;
    }
}
