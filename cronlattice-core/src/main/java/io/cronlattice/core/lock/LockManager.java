package io.cronlattice.core.lock;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.cronlattice.core.schedule.ScheduleKind;
import io.cronlattice.core.substrate.SubstrateExecutor;
import io.cronlattice.spi.KeyValueEntry;
import io.cronlattice.spi.KeyValueStore;
import io.cronlattice.spi.SubstrateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-occurrence execution lock on the key-value store.
 *
 * The lock is a create-if-absent write with a TTL, so a crashed holder
 * loses it when the lease ends. Next to the lock, a watermark records the
 * highest trigger generation that was executed. It is advanced only while
 * the lock is held and stops an instance that wins the lock late, after the
 * first holder released it, from executing the same occurrence again.
 */
public class LockManager
{
    private static final Logger logger = LoggerFactory.getLogger(LockManager.class);

    private static final Duration MIN_LEASE = Duration.ofSeconds(1);
    private static final int MAX_WATERMARK_ATTEMPTS = 10;

    private final KeyValueStore kv;
    private final SubstrateExecutor substrate;
    private final ObjectMapper mapper;
    private final Clock clock;

    @Inject
    public LockManager(KeyValueStore kv, SubstrateExecutor substrate, ObjectMapper mapper, Clock clock)
    {
        this.kv = kv;
        this.substrate = substrate;
        this.mapper = mapper;
        this.clock = clock;
    }

    static String lockKey(String jobKey)
    {
        return "lock." + jobKey;
    }

    static String firedKey(String jobKey)
    {
        return "fired." + jobKey;
    }

    /**
     * Lease of a job's lock for the occurrence contended at {@code now}.
     * The lock is never held past the job's next fire time, so a crashed
     * holder suppresses at most the occurrence it was executing.
     */
    public static Duration leaseFor(Duration configuredLease, ScheduleKind kind, Instant now)
    {
        Duration lease = configuredLease;
        Duration untilNextFire = Duration.between(now, kind.nextFire(now));
        if (untilNextFire.compareTo(lease) < 0) {
            lease = untilNextFire;
        }
        if (lease.compareTo(MIN_LEASE) < 0) {
            lease = MIN_LEASE;
        }
        return lease;
    }

    public CompletableFuture<Boolean> tryAcquire(String jobKey, String holderId, Duration lease, long generation)
    {
        LockEntry entry = LockEntry.of(jobKey, holderId, generation, clock.instant().plus(lease));
        String value = serialize(entry);
        return substrate.call("acquire lock of " + jobKey, () -> {
            if (kv.create(lockKey(jobKey), value, Optional.of(lease))) {
                return true;
            }
            // a retried create may have succeeded before its response was lost
            Optional<LockEntry> current = readLock(jobKey);
            return current.isPresent()
                && current.get().getHolderId().equals(holderId)
                && current.get().getGeneration() == generation;
        });
    }

    /**
     * Records that {@code generation} is being executed.
     *
     * @return a future of false if the generation or a later one was
     *         executed already
     */
    public CompletableFuture<Boolean> markFired(String jobKey, long generation)
    {
        String key = firedKey(jobKey);
        String value = Long.toString(generation);
        return substrate.call("advance fired watermark of " + jobKey, () -> {
            for (int i = 0; i < MAX_WATERMARK_ATTEMPTS; i++) {
                Optional<KeyValueEntry> current = kv.get(key);
                if (!current.isPresent()) {
                    if (kv.create(key, value, Optional.absent())) {
                        return true;
                    }
                    continue;
                }
                long fired = parseWatermark(jobKey, current.get().getValue());
                if (fired >= generation) {
                    return false;
                }
                if (kv.compareAndSet(key, current.get().getValue(), value)) {
                    return true;
                }
            }
            throw new SubstrateException("Fired watermark of " + jobKey + " kept changing concurrently");
        });
    }

    /**
     * Deletes the lock if this holder still owns it. Never fails; an entry
     * that could not be deleted expires with its lease.
     */
    public CompletableFuture<Void> release(String jobKey, String holderId)
    {
        return substrate.call("release lock of " + jobKey, () -> {
            Optional<KeyValueEntry> current = kv.get(lockKey(jobKey));
            if (current.isPresent() && deserialize(current.get().getValue()).getHolderId().equals(holderId)) {
                kv.compareAndDelete(lockKey(jobKey), current.get().getValue());
            }
            return (Void) null;
        })
        .exceptionally(ex -> {
            logger.warn("Failed to release lock of {}. It will expire with its lease: {}", jobKey, ex.toString());
            return null;
        });
    }

    /**
     * Removes the lock and the fired watermark of a job that was removed.
     * The returned future fails if the entries could not be deleted.
     */
    public CompletableFuture<Void> discard(String jobKey)
    {
        return substrate.call("discard lock of " + jobKey, () -> {
            kv.delete(firedKey(jobKey));
            kv.delete(lockKey(jobKey));
            return (Void) null;
        });
    }

    private Optional<LockEntry> readLock(String jobKey)
    {
        Optional<KeyValueEntry> current = kv.get(lockKey(jobKey));
        if (!current.isPresent()) {
            return Optional.absent();
        }
        return Optional.of(deserialize(current.get().getValue()));
    }

    private String serialize(LockEntry entry)
    {
        try {
            return mapper.writeValueAsString(entry);
        }
        catch (JsonProcessingException ex) {
            throw new IllegalStateException(ex);
        }
    }

    private LockEntry deserialize(String value)
    {
        try {
            return mapper.readValue(value, LockEntry.class);
        }
        catch (IOException ex) {
            throw new SubstrateException("Lock entry is not readable: " + value, ex);
        }
    }

    private static long parseWatermark(String jobKey, String value)
    {
        try {
            return Long.parseLong(value);
        }
        catch (NumberFormatException ex) {
            throw new SubstrateException("Fired watermark of " + jobKey + " is not a number: " + value, ex);
        }
    }
}
