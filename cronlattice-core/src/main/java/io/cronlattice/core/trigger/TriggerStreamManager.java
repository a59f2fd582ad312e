package io.cronlattice.core.trigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import com.google.common.base.Optional;
import io.cronlattice.core.substrate.SubstrateExecutor;
import io.cronlattice.spi.TriggerLog;
import io.cronlattice.spi.TriggerMarker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Arms and observes the trigger markers of one job.
 *
 * {@link #arm(Instant, long)} appends the next generation only if the
 * latest generation is still the expected one. When two instances re-arm
 * after the same occurrence, the first append wins and the second one is
 * rejected, so at most one marker exists per generation.
 */
public class TriggerStreamManager
{
    private static final Logger logger = LoggerFactory.getLogger(TriggerStreamManager.class);

    private final String jobKey;
    private final TriggerLog log;
    private final SubstrateExecutor substrate;
    private final Clock clock;

    private final Deque<TriggerMarker> delivered = new ArrayDeque<>();
    private CompletableFuture<TriggerMarker> waiting;
    private TriggerLog.Subscription subscription;

    public TriggerStreamManager(String jobKey, TriggerLog log, SubstrateExecutor substrate, Clock clock)
    {
        this.jobKey = jobKey;
        this.log = log;
        this.substrate = substrate;
        this.clock = clock;
    }

    public String getJobKey()
    {
        return jobKey;
    }

    /**
     * Starts receiving expiry notifications. Expired markers that no one
     * handled yet are delivered too.
     */
    public synchronized void open()
    {
        if (subscription == null) {
            subscription = log.subscribe(jobKey, this::onExpiry);
        }
    }

    public void close()
    {
        CompletableFuture<TriggerMarker> pending;
        synchronized (this) {
            if (subscription != null) {
                subscription.close();
                subscription = null;
            }
            delivered.clear();
            pending = waiting;
            waiting = null;
        }
        if (pending != null) {
            pending.cancel(false);
        }
    }

    public CompletableFuture<Optional<TriggerMarker>> getLatest()
    {
        return substrate.call("read latest trigger of " + jobKey, () -> log.getLatest(jobKey));
    }

    public CompletableFuture<Boolean> hasPending()
    {
        return getLatest().thenApply(latest ->
                latest.isPresent() && !latest.get().isExpiredAt(clock.instant()));
    }

    /**
     * Writes the marker that follows {@code expectedLatestGeneration}.
     *
     * @return a future of true if this call wrote the marker, false if another
     *         writer already armed that generation
     */
    public CompletableFuture<Boolean> arm(Instant fireAt, long expectedLatestGeneration)
    {
        Instant now = clock.instant();
        TriggerMarker marker = TriggerMarker.of(jobKey, expectedLatestGeneration + 1, fireAt, now);
        Duration ttl = Duration.between(now, fireAt);
        if (ttl.isNegative()) {
            ttl = Duration.ZERO;
        }
        Duration ttlForLog = ttl;
        return substrate.call("arm trigger of " + jobKey, () -> log.append(marker))
            .thenApply(appended -> {
                if (appended) {
                    logger.debug("Armed {} generation {} to fire at {} (in {})",
                            jobKey, marker.getGeneration(), fireAt, ttlForLog);
                }
                else {
                    logger.debug("Generation {} of {} is already armed by another writer",
                            marker.getGeneration(), jobKey);
                }
                return appended;
            });
    }

    /**
     * Returns a future completed with the next expired marker.
     */
    public CompletableFuture<TriggerMarker> awaitExpiry()
    {
        synchronized (this) {
            TriggerMarker marker = delivered.poll();
            if (marker != null) {
                return CompletableFuture.completedFuture(marker);
            }
            if (waiting == null || waiting.isDone()) {
                waiting = new CompletableFuture<>();
            }
            return waiting;
        }
    }

    public CompletableFuture<Void> purge()
    {
        return substrate.run("purge triggers of " + jobKey, () -> log.purge(jobKey));
    }

    private void onExpiry(TriggerMarker marker)
    {
        CompletableFuture<TriggerMarker> target;
        synchronized (this) {
            if (subscription == null) {
                return;
            }
            if (waiting == null || waiting.isDone()) {
                delivered.add(marker);
                return;
            }
            target = waiting;
            waiting = null;
        }
        // completing outside the monitor runs the waiting loop on this thread
        target.complete(marker);
    }
}
