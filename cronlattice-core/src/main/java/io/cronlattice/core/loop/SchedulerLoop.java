package io.cronlattice.core.loop;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import com.google.common.base.Optional;
import io.cronlattice.core.job.JobDefinition;
import io.cronlattice.core.job.JobRegistry;
import io.cronlattice.core.lock.LockManager;
import io.cronlattice.core.trigger.TriggerStreamManager;
import io.cronlattice.core.util.RetryExecutor.RetryGiveupException;
import io.cronlattice.spi.DispatchException;
import io.cronlattice.spi.DispatchRequest;
import io.cronlattice.spi.Dispatcher;
import io.cronlattice.spi.ImmutableDispatchRequest;
import io.cronlattice.spi.TriggerMarker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schedules one job on this instance.
 *
 * <pre>
 * REGISTERED -&gt; ARMED -&gt; CONTENDING -&gt; EXECUTING -&gt; ARMED ...
 *                                   \-&gt; SKIPPED   -&gt; ARMED ...
 * any state -&gt; REMOVED
 * </pre>
 *
 * An occurrence is executed in this order: compute the next fire time, arm
 * the next marker, dispatch, release the lock. Because the next marker is
 * written before dispatch, a crash during dispatch loses at most this
 * occurrence and never the schedule.
 *
 * Every step is chained on futures; no thread waits for a marker to expire.
 */
public class SchedulerLoop
{
    private static final Logger logger = LoggerFactory.getLogger(SchedulerLoop.class);

    private static final Duration RECOVERY_DELAY = Duration.ofSeconds(5);

    private final JobDefinition job;
    private final String jobKey;
    private final JobRegistry registry;
    private final TriggerStreamManager triggers;
    private final LockManager locks;
    private final Dispatcher dispatcher;
    private final Executor dispatchExecutor;
    private final ScheduledExecutorService timer;
    private final Clock clock;
    private final String holderId;
    private final Duration configuredLease;
    private final Duration dispatchTimeout;

    private volatile LoopState state = LoopState.REGISTERED;
    private volatile boolean stopped = false;
    private volatile long lastHandledGeneration = 0L;
    private volatile long seenRegistryGeneration;
    private volatile boolean registered = true;

    SchedulerLoop(JobDefinition job, JobRegistry registry, TriggerStreamManager triggers,
            LockManager locks, Dispatcher dispatcher, Executor dispatchExecutor,
            ScheduledExecutorService timer, Clock clock,
            String holderId, Duration configuredLease, Duration dispatchTimeout)
    {
        this.job = job;
        this.jobKey = job.getId().key();
        this.registry = registry;
        this.triggers = triggers;
        this.locks = locks;
        this.dispatcher = dispatcher;
        this.dispatchExecutor = dispatchExecutor;
        this.timer = timer;
        this.clock = clock;
        this.holderId = holderId;
        this.configuredLease = configuredLease;
        this.dispatchTimeout = dispatchTimeout;
    }

    public JobDefinition getJob()
    {
        return job;
    }

    public LoopState getState()
    {
        return state;
    }

    public boolean isStopped()
    {
        return stopped;
    }

    public void start()
    {
        seenRegistryGeneration = registry.getGeneration();
        logger.info("Scheduling job {} ({}) as {}", job.getId().key(), job.getScheduleKind(), holderId);
        triggers.open();
        ensureArmed();
        waitForExpiry();
    }

    /**
     * Stops this loop without touching the substrate. A lock held at this
     * moment is left to expire with its lease.
     */
    public void stop()
    {
        stopped = true;
        triggers.close();
    }

    /**
     * Stops this loop for good. If no definition with the same id is
     * registered any more, the job's markers, lock and watermark are
     * removed too.
     */
    public synchronized CompletableFuture<Void> remove()
    {
        if (state == LoopState.REMOVED) {
            return CompletableFuture.completedFuture(null);
        }
        state = LoopState.REMOVED;
        stop();
        logger.info("Stopped scheduling job {}", jobKey);

        if (registry.get(job.getId()).isPresent()) {
            // replaced by a new definition whose loop takes over the markers
            return CompletableFuture.completedFuture(null);
        }
        // purge only after the watermark is gone; a job added again restarts at generation 1
        return locks.discard(jobKey)
            .handle((v, error) -> {
                if (error != null) {
                    logger.warn("Failed to discard lock entries of removed job {}. Its trigger markers are kept: {}",
                            jobKey, unwrap(error).toString());
                    return false;
                }
                return true;
            })
            .thenCompose(discarded -> {
                if (!discarded) {
                    return done();
                }
                return triggers.purge()
                    .exceptionally(ex -> {
                        logger.warn("Failed to purge trigger markers of removed job {}: {}", jobKey, ex.toString());
                        return null;
                    });
            });
    }

    /**
     * Arms the next occurrence when the job has no marker to wait for.
     * An expired marker that this loop has not handled is left alone; its
     * redelivery fires once and realigns the schedule.
     */
    private void ensureArmed()
    {
        triggers.getLatest()
            .thenCompose(latest -> {
                if (stopped) {
                    return done();
                }
                Instant now = clock.instant();
                if (!latest.isPresent()) {
                    return rearm(0L, now);
                }
                TriggerMarker marker = latest.get();
                if (!marker.isExpiredAt(now)) {
                    logger.debug("Job {} has a pending trigger at {}", jobKey, marker.getFireAt());
                    return done();
                }
                if (marker.getGeneration() <= lastHandledGeneration) {
                    return rearm(marker.getGeneration(), now);
                }
                logger.info("Job {} missed its trigger at {}. It fires once and resumes its schedule",
                        jobKey, marker.getFireAt());
                return done();
            })
            .whenComplete((v, error) -> {
                if (error != null) {
                    logFailure("arming", error);
                    scheduleRecovery();
                }
            });
    }

    private void scheduleRecovery()
    {
        if (stopped) {
            return;
        }
        try {
            timer.schedule(() -> ensureArmed(), RECOVERY_DELAY.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (RejectedExecutionException ex) {
            logger.debug("Recovery of job {} is not scheduled because the provider is shutting down", jobKey);
        }
    }

    private void waitForExpiry()
    {
        if (stopped) {
            return;
        }
        state = LoopState.ARMED;
        triggers.awaitExpiry().whenComplete((marker, error) -> {
            if (error != null) {
                if (!(error instanceof CancellationException)) {
                    logger.error("An uncaught exception is ignored while waiting for a trigger of {}", jobKey, error);
                }
                return;
            }
            onExpiry(marker);
        });
    }

    private void onExpiry(TriggerMarker marker)
    {
        if (stopped) {
            return;
        }
        if (!isStillRegistered()) {
            remove();
            return;
        }
        if (marker.getGeneration() <= lastHandledGeneration) {
            logger.debug("Ignoring duplicate trigger {} of {}", marker.getGeneration(), jobKey);
            waitForExpiry();
            return;
        }
        lastHandledGeneration = marker.getGeneration();
        state = LoopState.CONTENDING;

        CompletableFuture<Void> occurrence;
        try {
            occurrence = contend(marker);
        }
        catch (RuntimeException ex) {
            occurrence = new CompletableFuture<>();
            occurrence.completeExceptionally(ex);
        }
        occurrence.whenComplete((v, error) -> {
            if (error != null) {
                logFailure("occurrence " + marker.getGeneration(), error);
                scheduleRecovery();
            }
            waitForExpiry();
        });
    }

    private CompletableFuture<Void> contend(TriggerMarker marker)
    {
        long generation = marker.getGeneration();
        Duration lease = LockManager.leaseFor(configuredLease, job.getScheduleKind(), clock.instant());
        return locks.tryAcquire(jobKey, holderId, lease, generation).thenCompose(acquired -> {
            if (!acquired) {
                logger.debug("Skipping trigger {} of {}: another instance holds the lock", generation, jobKey);
                return skip(marker);
            }
            if (stopped) {
                return done();
            }
            if (!isStillRegistered()) {
                return locks.release(jobKey, holderId).thenCompose(v -> remove());
            }
            return locks.markFired(jobKey, generation).thenCompose(first -> {
                if (!first) {
                    logger.debug("Skipping trigger {} of {}: already executed", generation, jobKey);
                    return locks.release(jobKey, holderId).thenCompose(v -> skip(marker));
                }
                return execute(marker);
            });
        });
    }

    private CompletableFuture<Void> skip(TriggerMarker marker)
    {
        state = LoopState.SKIPPED;
        if (stopped) {
            return done();
        }
        return rearm(marker.getGeneration(), clock.instant());
    }

    private CompletableFuture<Void> execute(TriggerMarker marker)
    {
        state = LoopState.EXECUTING;
        Instant now = clock.instant();
        Instant scheduledTime = occurrenceTime(marker, now);
        logger.debug("Firing trigger {} of {} scheduled at {}", marker.getGeneration(), jobKey, scheduledTime);

        return rearm(marker.getGeneration(), now)
            .thenCompose(v -> {
                if (stopped) {
                    logger.debug("Trigger {} of {} is abandoned before dispatch", marker.getGeneration(), jobKey);
                    return done();
                }
                return dispatch(scheduledTime)
                    .thenCompose(d -> stopped ? done() : locks.release(jobKey, holderId));
            });
    }

    private CompletableFuture<Void> rearm(long expectedGeneration, Instant now)
    {
        Instant next = job.getScheduleKind().nextFire(now);
        return triggers.arm(next, expectedGeneration).thenApply(armed -> (Void) null);
    }

    /**
     * Time of the occurrence being executed. After an outage longer than a
     * period, a fixed interval job fires once for the latest grid boundary.
     */
    private Instant occurrenceTime(TriggerMarker marker, Instant now)
    {
        Optional<Duration> period = job.getScheduleKind().getPeriod();
        if (period.isPresent()) {
            long seconds = period.get().getSeconds();
            Instant boundary = Instant.ofEpochSecond(Math.floorDiv(now.getEpochSecond(), seconds) * seconds);
            if (boundary.isAfter(marker.getFireAt())) {
                return boundary;
            }
        }
        return marker.getFireAt();
    }

    private CompletableFuture<Void> dispatch(Instant scheduledTime)
    {
        DispatchRequest request = ImmutableDispatchRequest.builder()
            .targetId(job.getId().getTargetId())
            .linkName(job.getId().getLinkName())
            .jobName(job.getId().getJobName())
            .scheduledTime(scheduledTime)
            .payload(job.getPayload())
            .build();

        CompletableFuture<Void> future = new CompletableFuture<>();
        try {
            dispatchExecutor.execute(() -> {
                try {
                    dispatcher.dispatch(request);
                    future.complete(null);
                }
                catch (DispatchException | RuntimeException ex) {
                    future.completeExceptionally(ex);
                }
            });
        }
        catch (RejectedExecutionException ex) {
            future.completeExceptionally(ex);
        }
        if (!future.isDone()) {
            future.orTimeout(dispatchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        return future.handle((v, error) -> {
            if (error == null) {
                logger.info("Dispatched job {} scheduled at {}", jobKey, scheduledTime);
            }
            else {
                Throwable cause = unwrap(error);
                if (cause instanceof TimeoutException) {
                    logger.warn("Dispatch of job {} scheduled at {} did not finish within {}",
                            jobKey, scheduledTime, dispatchTimeout);
                }
                else {
                    logger.warn("Dispatch of job {} scheduled at {} failed: {}",
                            jobKey, scheduledTime, cause.toString());
                }
            }
            return (Void) null;
        });
    }

    private boolean isStillRegistered()
    {
        long generation = registry.getGeneration();
        if (generation != seenRegistryGeneration) {
            seenRegistryGeneration = generation;
            registered = registry.isCurrent(job);
        }
        return registered;
    }

    private void logFailure(String what, Throwable error)
    {
        Throwable cause = unwrap(error);
        if (cause instanceof RetryGiveupException) {
            logger.warn("Giving up {} of job {}: substrate is not available: {}",
                    what, jobKey, cause.getCause().toString());
        }
        else if (cause instanceof CancellationException) {
            logger.debug("{} of job {} is cancelled", what, jobKey);
        }
        else {
            logger.error("An uncaught exception is ignored. Scheduling of job {} continues", jobKey, cause);
        }
    }

    private static CompletableFuture<Void> done()
    {
        return CompletableFuture.completedFuture(null);
    }

    private static Throwable unwrap(Throwable error)
    {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    @Override
    public String toString()
    {
        return "SchedulerLoop{job=" + jobKey + ", state=" + state + "}";
    }
}
