package io.cronlattice.core.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.cronlattice.spi.KeyValueEntry;
import io.cronlattice.spi.KeyValueStore;

public class MemoryKeyValueStore
        implements KeyValueStore
{
    private final Clock clock;
    private final Map<String, KeyValueEntry> entries = new HashMap<>();

    @Inject
    public MemoryKeyValueStore(Clock clock)
    {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<KeyValueEntry> get(String key)
    {
        return Optional.fromNullable(live(key));
    }

    @Override
    public synchronized boolean create(String key, String value, Optional<Duration> ttl)
    {
        if (live(key) != null) {
            return false;
        }
        Optional<Instant> expiresAt = ttl.isPresent()
            ? Optional.of(clock.instant().plus(ttl.get()))
            : Optional.absent();
        entries.put(key, KeyValueEntry.of(key, value, expiresAt));
        return true;
    }

    @Override
    public synchronized boolean compareAndSet(String key, String expectedValue, String newValue)
    {
        KeyValueEntry entry = live(key);
        if (entry == null || !entry.getValue().equals(expectedValue)) {
            return false;
        }
        entries.put(key, KeyValueEntry.of(key, newValue, entry.getExpiresAt()));
        return true;
    }

    @Override
    public synchronized boolean compareAndDelete(String key, String expectedValue)
    {
        KeyValueEntry entry = live(key);
        if (entry == null || !entry.getValue().equals(expectedValue)) {
            return false;
        }
        entries.remove(key);
        return true;
    }

    @Override
    public synchronized void delete(String key)
    {
        entries.remove(key);
    }

    private KeyValueEntry live(String key)
    {
        KeyValueEntry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.getExpiresAt().isPresent() && !entry.getExpiresAt().get().isAfter(clock.instant())) {
            entries.remove(key);
            return null;
        }
        return entry;
    }
}
