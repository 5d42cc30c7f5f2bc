package com.example.taskreminder.service.reminder;

import com.example.taskreminder.config.TaskReminderProperties;
import com.example.taskreminder.exception.ReminderTickException;
import com.example.taskreminder.exception.SchedulerStartupException;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Owns the recurring reminder tick.
 * <p>
 * States: STOPPED, then RUNNING after {@link #start()}, then STOPPED after
 * {@link #stop()}. Calling start while running replaces the recurring job;
 * calling stop while stopped does nothing.
 * <p>
 * Ticks never overlap: inside one instance a tick that is still running
 * makes the next one skip, and across instances ShedLock lets only one
 * holder of the {@value #LOCK_NAME} lock scan at a time.
 * <p>
 * Stopping lets the in-flight tick finish the reminder it is working on
 * (send plus mark-sent) and waits for it up to the configured timeout.
 * A stop only ends ticks that were already running when it was issued;
 * ticks triggered on demand afterwards run to completion.
 */
@Slf4j
@Component
public class ReminderScheduler implements SmartLifecycle {

    static final String LOCK_NAME = "reminderTick";

    private final ReminderDispatchService dispatchService;
    private final ThreadPoolTaskScheduler taskScheduler;
    private final LockingTaskExecutor lockingTaskExecutor;
    private final TaskReminderProperties properties;
    private final Clock clock;

    private final Object lifecycleMonitor = new Object();
    private final ReentrantLock tickLock = new ReentrantLock();

    /**
     * Bumped by every stop; a tick stops early once the value it started with is stale
     */
    private final AtomicLong stopGeneration = new AtomicLong();

    private volatile ScheduledFuture<?> scheduledTick;

    public ReminderScheduler(ReminderDispatchService dispatchService,
                             @Qualifier("reminderTaskScheduler") ThreadPoolTaskScheduler taskScheduler,
                             LockingTaskExecutor lockingTaskExecutor,
                             TaskReminderProperties properties,
                             Clock clock) {
        this.dispatchService = dispatchService;
        this.taskScheduler = taskScheduler;
        this.lockingTaskExecutor = lockingTaskExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Register the recurring tick. If already running, the existing job is
     * cancelled and replaced.
     *
     * @throws SchedulerStartupException if the tick cannot be registered
     */
    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (scheduledTick != null) {
                log.info("Reminder scheduler already running, replacing the recurring tick");
                scheduledTick.cancel(false);
                scheduledTick = null;
            }

            var pollInterval = properties.getPollInterval();

            try {
                scheduledTick = taskScheduler.scheduleAtFixedRate(this::runScheduledTick, pollInterval);
            } catch (RuntimeException e) {
                throw new SchedulerStartupException("Could not register the recurring reminder tick", e);
            }

            log.info("Reminder scheduler started, ticking every {} minute(s)", pollInterval.toMinutes());
        }
    }

    /**
     * Cancel the recurring tick and wait for an in-flight tick to finish
     * its current reminder. Safe to call when already stopped.
     */
    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (scheduledTick == null) {
                log.debug("Reminder scheduler already stopped");
                return;
            }
            stopGeneration.incrementAndGet();
            scheduledTick.cancel(false);
            scheduledTick = null;
        }

        awaitInFlightTick();
        log.info("Reminder scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return scheduledTick != null;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStart();
    }

    public SchedulerState getState() {
        return isRunning() ? SchedulerState.RUNNING : SchedulerState.STOPPED;
    }

    /**
     * Run one tick on the calling thread, subject to the same overlap
     * guards as scheduled ticks. Works whether or not the recurring job is running.
     *
     * @return the tick summary, or empty if another tick holds a lock
     * @throws ReminderTickException if the tick itself failed
     */
    public Optional<TickResult> triggerTick() {
        return runGuardedTick(stopGeneration.get());
    }

    private void runScheduledTick() {
        var generation = stopGeneration.get();
        if (!isRunning()) {
            return;
        }
        try {
            runGuardedTick(generation);
        } catch (ReminderTickException e) {
            log.error("Scheduled reminder tick failed: {}", e.getCause().getMessage(), e.getCause());
        }
    }

    private Optional<TickResult> runGuardedTick(long generation) {
        if (!tickLock.tryLock()) {
            log.debug("Previous reminder tick still running, skipping");
            return Optional.empty();
        }

        try {
            BooleanSupplier stopRequested = () -> stopGeneration.get() != generation;
            LockingTaskExecutor.TaskWithResult<TickResult> tick = () -> dispatchService.runTick(clock.instant(), stopRequested);
            var outcome = lockingTaskExecutor.executeWithLock(tick, lockConfiguration());

            if (!outcome.wasExecuted()) {
                log.debug("Reminder tick lock is held by another instance, skipping");
                return Optional.empty();
            }
            return Optional.ofNullable(outcome.getResult());
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            throw new ReminderTickException("Reminder tick failed", t);
        } finally {
            tickLock.unlock();
        }
    }

    private LockConfiguration lockConfiguration() {
        return new LockConfiguration(
                clock.instant(),
                LOCK_NAME,
                Duration.ofMinutes(properties.getLockAtMostForMinutes()),
                Duration.ZERO);
    }

    private void awaitInFlightTick() {
        var timeoutSeconds = properties.getShutdownTimeoutSeconds();
        try {
            if (tickLock.tryLock(timeoutSeconds, TimeUnit.SECONDS)) {
                tickLock.unlock();
            } else {
                log.warn("In-flight reminder tick did not finish within {}s", timeoutSeconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the in-flight reminder tick");
        }
    }
}
