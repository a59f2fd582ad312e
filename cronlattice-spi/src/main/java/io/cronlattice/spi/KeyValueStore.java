package io.cronlattice.spi;

import java.time.Duration;
import com.google.common.base.Optional;

/**
 * Strongly consistent key-value store.
 *
 * Entries created with a TTL disappear when the TTL elapses: get() no longer
 * returns them and create() can write the key again. All methods throw
 * {@link SubstrateException} when the store is not reachable.
 */
public interface KeyValueStore
{
    Optional<KeyValueEntry> get(String key);

    /**
     * Writes the key only if it does not exist (or exists but expired).
     *
     * @return true if this call created the entry
     */
    boolean create(String key, String value, Optional<Duration> ttl);

    boolean compareAndSet(String key, String expectedValue, String newValue);

    boolean compareAndDelete(String key, String expectedValue);

    void delete(String key);
}
