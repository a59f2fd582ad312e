package io.cronlattice.core.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.cronlattice.core.substrate.PollingTriggerLog;
import io.cronlattice.core.substrate.SubstrateConfig;
import io.cronlattice.spi.TriggerMarker;

/**
 * In-process trigger log. Sharing one instance between several providers
 * behaves like a lattice of instances on a common substrate.
 */
public class MemoryTriggerLog
        extends PollingTriggerLog
{
    // older generations are of no use once a newer marker exists
    private static final int RETAINED_MARKERS = 2;

    private final Map<String, Deque<TriggerMarker>> logs = new HashMap<>();

    @Inject
    public MemoryTriggerLog(Clock clock, SubstrateConfig config)
    {
        this(clock, config.getPollInterval());
    }

    public MemoryTriggerLog(Clock clock, Duration pollInterval)
    {
        super(clock, pollInterval);
    }

    @Override
    public synchronized Optional<TriggerMarker> getLatest(String jobKey)
    {
        Deque<TriggerMarker> log = logs.get(jobKey);
        if (log == null || log.isEmpty()) {
            return Optional.absent();
        }
        return Optional.of(log.peekLast());
    }

    @Override
    public synchronized boolean append(TriggerMarker marker)
    {
        Deque<TriggerMarker> log = logs.computeIfAbsent(marker.getJobKey(), key -> new ArrayDeque<>());
        long latest = log.isEmpty() ? 0L : log.peekLast().getGeneration();
        if (marker.getGeneration() != latest + 1) {
            return false;
        }
        log.addLast(marker);
        while (log.size() > RETAINED_MARKERS) {
            log.removeFirst();
        }
        return true;
    }

    @Override
    public synchronized void purge(String jobKey)
    {
        logs.remove(jobKey);
    }
}
