package io.cronlattice.core.substrate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.cronlattice.core.BackgroundService;
import io.cronlattice.spi.ExpiryListener;
import io.cronlattice.spi.SubstrateException;
import io.cronlattice.spi.TriggerLog;
import io.cronlattice.spi.TriggerMarker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TriggerLog whose expiry notifications come from periodically reading the
 * latest marker of every subscribed job.
 *
 * Each subscription is notified at most once per generation, in increasing
 * generation order. Markers that are already expired when the subscription
 * is made are delivered on the next poll.
 */
public abstract class PollingTriggerLog
        implements TriggerLog, BackgroundService
{
    private static final Logger logger = LoggerFactory.getLogger(PollingTriggerLog.class);

    private final Clock clock;
    private final Duration pollInterval;
    private final Map<Long, PollingSubscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong nextSubscriptionId = new AtomicLong(0);
    private ScheduledExecutorService poller;

    protected PollingTriggerLog(Clock clock, Duration pollInterval)
    {
        this.clock = clock;
        this.pollInterval = pollInterval;
    }

    protected Clock getClock()
    {
        return clock;
    }

    @Override
    public Subscription subscribe(String jobKey, ExpiryListener listener)
    {
        long id = nextSubscriptionId.incrementAndGet();
        PollingSubscription subscription = new PollingSubscription(id, jobKey, listener);
        subscriptions.put(id, subscription);
        return subscription;
    }

    @Override
    public synchronized void start()
    {
        if (poller == null) {
            poller = Executors.newSingleThreadScheduledExecutor(
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("trigger-poller-%d")
                    .build()
                    );
            long millis = pollInterval.toMillis();
            poller.scheduleWithFixedDelay(() -> poll(), millis, millis, TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public synchronized void shutdown()
    {
        if (poller != null) {
            poller.shutdownNow();
            poller = null;
        }
    }

    @VisibleForTesting
    public void poll()
    {
        try {
            Instant now = clock.instant();
            for (Map.Entry<String, List<PollingSubscription>> pair : subscriptionsByJob().entrySet()) {
                pollJob(pair.getKey(), pair.getValue(), now);
            }
        }
        catch (Throwable t) {
            logger.error("An uncaught exception is ignored. Polling will be retried.", t);
        }
    }

    private void pollJob(String jobKey, List<PollingSubscription> subs, Instant now)
    {
        Optional<TriggerMarker> latest;
        try {
            latest = getLatest(jobKey);
        }
        catch (SubstrateException ex) {
            logger.warn("Failed to read trigger log of {}. Will retry at next poll: {}", jobKey, ex.toString());
            return;
        }
        if (!latest.isPresent() || !latest.get().isExpiredAt(now)) {
            return;
        }
        for (PollingSubscription sub : subs) {
            sub.deliver(latest.get());
        }
    }

    private Map<String, List<PollingSubscription>> subscriptionsByJob()
    {
        Map<String, List<PollingSubscription>> map = new LinkedHashMap<>();
        List<PollingSubscription> sorted = new ArrayList<>(subscriptions.values());
        sorted.sort((a, b) -> Long.compare(a.id, b.id));
        for (PollingSubscription sub : sorted) {
            map.computeIfAbsent(sub.jobKey, key -> new ArrayList<>()).add(sub);
        }
        return map;
    }

    private class PollingSubscription
            implements Subscription
    {
        private final long id;
        private final String jobKey;
        private final ExpiryListener listener;
        private long lastDelivered = 0L;
        private volatile boolean closed = false;

        PollingSubscription(long id, String jobKey, ExpiryListener listener)
        {
            this.id = id;
            this.jobKey = jobKey;
            this.listener = listener;
        }

        void deliver(TriggerMarker marker)
        {
            synchronized (this) {
                if (closed || marker.getGeneration() <= lastDelivered) {
                    return;
                }
                lastDelivered = marker.getGeneration();
            }
            try {
                listener.onExpiry(marker);
            }
            catch (RuntimeException ex) {
                logger.error("An uncaught exception from an expiry listener of {} is ignored", jobKey, ex);
            }
        }

        @Override
        public void close()
        {
            closed = true;
            subscriptions.remove(id);
        }
    }
}
