package com.company.monitoring.scheduled;

import com.company.monitoring.domain.CycleResult;
import com.company.monitoring.domain.enums.SchedulerState;
import com.company.monitoring.event.PollingIntervalChangedEvent;
import com.company.monitoring.service.HealthStatusTracker;
import com.company.monitoring.service.MonitoredItemRegistry;
import com.company.monitoring.service.MonitoringConfigManager;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives {@link MonitoringCycle} on a fixed-rate timer.
 *
 * <p>State moves IDLE → PENDING → RUNNING → IDLE through {@link #transition}. A tick that finds
 * the scheduler in any other state than IDLE is skipped, so cycles never overlap or queue up.
 * Cycles run on a dedicated single thread; each one completes its own completion signal, which
 * {@link #stop()} awaits with a hard deadline.
 */
@Component
@Slf4j
public class MonitoringCycleScheduler {

    private final MonitoringCycle cycle;
    private final MonitoringConfigManager configManager;
    private final MonitoredItemRegistry registry;
    private final HealthStatusTracker healthTracker;
    private final TaskScheduler taskScheduler;
    private final MeterRegistry meterRegistry;
    private final ExecutorService cycleExecutor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "monitoring-cycle");
        thread.setDaemon(true);
        return thread;
    });
    private final Object lifecycleLock = new Object();

    @Value("${monitoring.scheduler.shutdown-timeout-ms:30000}")
    private long shutdownTimeoutMs = 30_000L;

    @Value("${monitoring.scheduler.startup-timeout-ms:120000}")
    private long startupTimeoutMs = 120_000L;

    // guarded by this
    private SchedulerState state = SchedulerState.IDLE;
    private ScheduledFuture<?> timer;
    private CompletableFuture<CycleResult> currentCycle;
    private long activeIntervalMs;
    private long lifecycleGeneration;

    public MonitoringCycleScheduler(MonitoringCycle cycle,
                                    MonitoringConfigManager configManager,
                                    MonitoredItemRegistry registry,
                                    HealthStatusTracker healthTracker,
                                    @Qualifier("cycleTaskScheduler") TaskScheduler taskScheduler,
                                    MeterRegistry meterRegistry) {
        this.cycle = cycle;
        this.configManager = configManager;
        this.registry = registry;
        this.healthTracker = healthTracker;
        this.taskScheduler = taskScheduler;
        this.meterRegistry = meterRegistry;
    }

    public synchronized SchedulerState getState() {
        return state;
    }

    public synchronized boolean isStarted() {
        return timer != null;
    }

    public synchronized long getActiveIntervalMs() {
        return activeIntervalMs;
    }

    /**
     * Runs one cycle synchronously, then arms the timer. Restarts if already started.
     *
     * <p>The initial cycle is awaited outside the lifecycle lock. A start that is stopped or
     * superseded while waiting does not arm the timer.
     */
    public void start() {
        long intervalMs;
        long generation;
        CompletableFuture<CycleResult> initial;
        synchronized (lifecycleLock) {
            if (isStarted()) {
                log.info("Scheduler already running, restarting");
                stop();
            }

            intervalMs = configManager.current().getPollingIntervalMs();
            log.info("Starting monitoring scheduler with {}ms polling interval", intervalMs);

            synchronized (this) {
                generation = ++lifecycleGeneration;
            }
            initial = triggerCycle();
        }

        if (initial != null) {
            try {
                initial.get(startupTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("Initial cycle still running after {}ms, arming timer anyway", startupTimeoutMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for the initial cycle");
            } catch (ExecutionException e) {
                log.error("Initial cycle failed", e.getCause());
            }
        }

        synchronized (lifecycleLock) {
            synchronized (this) {
                if (generation != lifecycleGeneration || timer != null) {
                    log.info("Scheduler was stopped or restarted during startup, not arming the timer");
                    return;
                }
                timer = taskScheduler.scheduleAtFixedRate(this::tick,
                        Instant.now().plusMillis(intervalMs), Duration.ofMillis(intervalMs));
                activeIntervalMs = intervalMs;
            }
        }
        log.info("Monitoring scheduler started");
    }

    /**
     * Suppresses new cycles, cancels the timer and waits for the running cycle up to the
     * shutdown timeout. Alert and frozen state is cleared; the last value cache survives.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            CompletableFuture<CycleResult> running;
            synchronized (this) {
                lifecycleGeneration++;
                transition(SchedulerState.SHUTTING_DOWN);
                if (timer != null) {
                    timer.cancel(false);
                    timer = null;
                }
                running = currentCycle;
            }
            log.info("Stopping monitoring scheduler");

            if (running != null && !running.isDone()) {
                log.info("Waiting up to {}ms for the running cycle to complete", shutdownTimeoutMs);
                try {
                    running.get(shutdownTimeoutMs, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    log.warn("Cycle did not complete within {}ms, forcing shutdown", shutdownTimeoutMs);
                    meterRegistry.counter("monitoring.scheduler.forced.shutdowns").increment();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for the running cycle, forcing shutdown");
                } catch (ExecutionException e) {
                    log.warn("Running cycle ended with an error during shutdown", e.getCause());
                }
            }

            registry.clearAlertStates();
            transition(SchedulerState.IDLE, SchedulerState.SHUTTING_DOWN);
            log.info("Monitoring scheduler stopped");
        }
    }

    /**
     * Timer entry point. Skipped unless the scheduler is IDLE.
     */
    void tick() {
        if (triggerCycle() == null) {
            meterRegistry.counter("monitoring.cycle.skipped").increment();
        }
    }

    /**
     * Queues a cycle when the scheduler is IDLE.
     *
     * @return the cycle's completion signal, or null when the request was skipped
     */
    public CompletableFuture<CycleResult> triggerCycle() {
        CompletableFuture<CycleResult> signal = new CompletableFuture<>();
        synchronized (this) {
            if (!transition(SchedulerState.PENDING, SchedulerState.IDLE)) {
                log.warn("Skipping monitoring cycle: scheduler is {}", state);
                return null;
            }
            currentCycle = signal;
        }

        try {
            cycleExecutor.execute(() -> runCycle(signal));
        } catch (RejectedExecutionException e) {
            log.error("Cycle executor rejected the cycle", e);
            finishCycle(signal);
            signal.complete(CycleResult.skipped("Cycle executor unavailable"));
            return null;
        }
        return signal;
    }

    private void runCycle(CompletableFuture<CycleResult> signal) {
        CycleResult result = null;
        try {
            if (!transition(SchedulerState.RUNNING, SchedulerState.PENDING)) {
                result = CycleResult.skipped("Scheduler is shutting down");
                return;
            }
            result = cycle.execute();
        } catch (RuntimeException e) {
            log.error("Monitoring cycle failed", e);
            healthTracker.recordCycleFailure(e.getMessage());
            result = CycleResult.skipped("Cycle failed: " + e.getMessage());
        } finally {
            finishCycle(signal);
            signal.complete(result);
        }
    }

    private synchronized void finishCycle(CompletableFuture<CycleResult> signal) {
        // A cycle abandoned by a forced shutdown must not reset the state of its successor
        if (currentCycle == signal) {
            currentCycle = null;
            transition(SchedulerState.IDLE, SchedulerState.RUNNING, SchedulerState.PENDING);
        }
    }

    /**
     * Single mutation point of the scheduler state.
     *
     * @param allowedFrom states the transition may start from; empty means any
     * @return true when the state changed
     */
    private synchronized boolean transition(SchedulerState next, SchedulerState... allowedFrom) {
        if (allowedFrom.length > 0) {
            boolean allowed = false;
            for (SchedulerState from : allowedFrom) {
                if (state == from) {
                    allowed = true;
                    break;
                }
            }
            if (!allowed) {
                return false;
            }
        }
        log.debug("Scheduler state {} -> {}", state, next);
        state = next;
        healthTracker.recordSchedulerState(next);
        return true;
    }

    @EventListener
    @Async
    public void onPollingIntervalChanged(PollingIntervalChangedEvent event) {
        if (!isStarted()) {
            return;
        }
        log.info("Restarting scheduler for new polling interval {}ms (was {}ms)",
                event.getNewIntervalMs(), event.getPreviousIntervalMs());
        start();
    }

    @PreDestroy
    public void shutdown() {
        stop();
        cycleExecutor.shutdownNow();
    }
}
