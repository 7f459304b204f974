package com.example.integritychecker.scheduling;

import com.example.integritychecker.config.IntegrityCheckerProperties;
import com.example.integritychecker.model.CheckInterval;
import com.example.integritychecker.service.CheckResult;
import com.example.integritychecker.service.IntegrityCheckService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs integrity checks periodically and on demand.
 * <ul>
 *   <li>one periodic schedule; rescheduling replaces it</li>
 *   <li>one pending immediate check; a new request replaces (and interrupts) the previous one</li>
 *   <li>retry-worthy failures are re-run with exponential backoff; periodic ticks are
 *       skipped while a periodic retry is pending</li>
 *   <li>runs are deferred while the network is unavailable</li>
 * </ul>
 */
@Component
public class CheckScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CheckScheduler.class);

    static final String PERIODIC_WORK_NAME = "integrity_periodic_check";
    static final String IMMEDIATE_WORK_NAME = "integrity_immediate_check";

    private final TaskScheduler taskScheduler;
    private final IntegrityCheckService checkService;
    private final NetworkAvailability networkAvailability;
    private final IntegrityCheckerProperties.Schedule schedule;

    private final ReentrantLock runLock = new ReentrantLock();
    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();
    private final Map<String, Integer> attempts = new ConcurrentHashMap<>();

    private volatile ScheduledFuture<?> periodic;
    private volatile int periodicIntervalMinutes;

    public CheckScheduler(TaskScheduler taskScheduler,
                          IntegrityCheckService checkService,
                          NetworkAvailability networkAvailability,
                          IntegrityCheckerProperties properties) {
        this.taskScheduler = taskScheduler;
        this.checkService = checkService;
        this.networkAvailability = networkAvailability;
        this.schedule = properties.getSchedule();
    }

    /**
     * Schedules the background check, replacing any existing schedule. Intervals
     * below {@link CheckInterval#MIN_INTERVAL_MINUTES} are clamped.
     */
    public synchronized void schedulePeriodic(int intervalMinutes) {
        int actualInterval = CheckInterval.clamp(intervalMinutes);
        if (actualInterval != intervalMinutes) {
            logger.warn("Invalid interval {} min clamped to {} min", intervalMinutes, actualInterval);
        }

        boolean alreadyScheduled = isPeriodicScheduled();
        if (alreadyScheduled && periodicIntervalMinutes == actualInterval) {
            logger.debug("Periodic check already scheduled every {}", CheckInterval.labelFor(actualInterval));
            return;
        }

        Duration period = Duration.ofMinutes(actualInterval);
        Instant firstRun = alreadyScheduled ? Instant.now().plus(period) : Instant.now();
        cancelPeriodic();

        periodic = taskScheduler.scheduleAtFixedRate(this::periodicTick, firstRun, period);
        periodicIntervalMinutes = actualInterval;
        logger.info("Scheduled periodic integrity check every {}", CheckInterval.labelFor(actualInterval));
    }

    /**
     * Runs a check as soon as possible. A pending or running immediate check is replaced.
     */
    public void scheduleImmediate() {
        logger.info("Scheduling immediate integrity check");
        attempts.remove(IMMEDIATE_WORK_NAME);
        scheduleOnce(IMMEDIATE_WORK_NAME, Duration.ZERO, true);
    }

    public synchronized void cancelPeriodic() {
        ScheduledFuture<?> current = periodic;
        if (current != null) {
            logger.info("Cancelling periodic integrity check");
            current.cancel(false);
        }
        periodic = null;
        periodicIntervalMinutes = 0;
        cancelPending(PERIODIC_WORK_NAME, false);
        attempts.remove(PERIODIC_WORK_NAME);
    }

    public synchronized void cancelAll() {
        logger.info("Cancelling all integrity check work");
        cancelPeriodic();
        cancelPending(IMMEDIATE_WORK_NAME, true);
        attempts.clear();
    }

    public boolean isPeriodicScheduled() {
        ScheduledFuture<?> current = periodic;
        return current != null && !current.isCancelled() && !current.isDone();
    }

    public int getPeriodicIntervalMinutes() {
        return periodicIntervalMinutes;
    }

    void periodicTick() {
        ScheduledFuture<?> retry = pending.get(PERIODIC_WORK_NAME);
        if (retry != null && !retry.isDone()) {
            logger.debug("Periodic retry pending, skipping tick");
            return;
        }
        execute(PERIODIC_WORK_NAME);
    }

    void execute(String workName) {
        if (!networkAvailability.isAvailable()) {
            logger.info("Network unavailable, deferring {} by {}", workName, schedule.getNetworkRetry());
            scheduleOnce(workName, schedule.getNetworkRetry(), false);
            return;
        }

        CheckResult result;
        runLock.lock();
        try {
            result = checkService.runCheck();
        } finally {
            runLock.unlock();
        }

        if (result instanceof CheckResult.Retry retry) {
            int attempt = attempts.merge(workName, 1, Integer::sum);
            Duration delay = backoff(attempt);
            logger.warn("Integrity check {} will be retried in {} (attempt {}): {}",
                    workName, delay, attempt, retry.message());
            scheduleOnce(workName, delay, false);
        } else {
            attempts.remove(workName);
            if (result instanceof CheckResult.Failure failure) {
                logger.error("Integrity check {} failed permanently: {}", workName, failure.message());
            }
        }
    }

    Duration backoff(int attempt) {
        Duration initial = schedule.getInitialBackoff();
        Duration max = schedule.getMaxBackoff();
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        Duration delay = initial.multipliedBy(1L << shift);
        return delay.compareTo(max) > 0 ? max : delay;
    }

    private void scheduleOnce(String workName, Duration delay, boolean interruptPrevious) {
        ScheduledFuture<?> future = taskScheduler.schedule(() -> execute(workName), Instant.now().plus(delay));
        ScheduledFuture<?> previous = pending.put(workName, future);
        if (previous != null && previous != future) {
            previous.cancel(interruptPrevious);
        }
    }

    private void cancelPending(String workName, boolean interrupt) {
        ScheduledFuture<?> future = pending.remove(workName);
        if (future != null) {
            future.cancel(interrupt);
        }
    }
}
