package io.cronlattice.core.lock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import com.google.common.base.Optional;
import com.google.common.util.concurrent.MoreExecutors;
import io.cronlattice.core.ManualClock;
import io.cronlattice.core.config.ObjectMappers;
import io.cronlattice.core.memory.MemoryKeyValueStore;
import io.cronlattice.core.schedule.CronExpression;
import io.cronlattice.core.schedule.ScheduleKind;
import io.cronlattice.core.substrate.SubstrateExecutor;
import io.cronlattice.core.util.RetryExecutor.RetryGiveupException;
import io.cronlattice.spi.KeyValueStore;
import io.cronlattice.spi.SubstrateException;
import org.junit.Test;

import static io.cronlattice.core.util.RetryExecutor.retryExecutor;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class LockManagerTest
{
    private static final Duration LEASE = Duration.ofSeconds(5);

    private final ManualClock clock = new ManualClock(Instant.parse("2024-01-15T10:00:00Z"));
    private final MemoryKeyValueStore kv = new MemoryKeyValueStore(clock);
    private final SubstrateExecutor substrate = new SubstrateExecutor(
            MoreExecutors.directExecutor(), retryExecutor().withRetryLimit(2));
    private final LockManager locks = new LockManager(kv, substrate, ObjectMappers.objectMapper(), clock);

    private LockManager locksOn(KeyValueStore store)
    {
        return new LockManager(store, substrate, ObjectMappers.objectMapper(), clock);
    }

    @Test
    public void leaseEndsAtNextFireTime()
    {
        Duration configured = Duration.ofSeconds(30);
        Instant now = Instant.parse("2024-01-15T10:00:00Z");
        assertThat(LockManager.leaseFor(configured, ScheduleKind.fixedInterval(Duration.ofSeconds(5)), now), is(Duration.ofSeconds(5)));
        assertThat(LockManager.leaseFor(configured, ScheduleKind.fixedInterval(Duration.ofSeconds(5)), now.plusSeconds(2)), is(Duration.ofSeconds(3)));
        assertThat(LockManager.leaseFor(configured, ScheduleKind.fixedInterval(Duration.ofHours(1)), now), is(configured));
        assertThat(LockManager.leaseFor(configured, complex("0 30 * * * *"), now), is(configured));
        assertThat(LockManager.leaseFor(Duration.ofMillis(100), ScheduleKind.fixedInterval(Duration.ofSeconds(1)), now), is(Duration.ofSeconds(1)));
    }

    @Test
    public void leaseOfFrequentComplexJobEndsAtNextFireTime()
    {
        Duration configured = Duration.ofSeconds(30);
        ScheduleKind businessHours = complex("* * 9-17 * * *");
        assertThat(LockManager.leaseFor(configured, businessHours, Instant.parse("2024-01-15T10:00:00Z")), is(Duration.ofSeconds(1)));
        // the last occurrence of the day keeps the configured lease
        assertThat(LockManager.leaseFor(configured, businessHours, Instant.parse("2024-01-15T17:59:59Z")), is(configured));
    }

    private static ScheduleKind complex(String expression)
    {
        return ScheduleKind.complex(CronExpression.parse(expression));
    }

    @Test
    public void onlyOneRacerAcquires()
            throws Exception
    {
        int acquired = 0;
        for (int i = 0; i < 5; i++) {
            if (locks.tryAcquire("job", "instance-" + i, LEASE, 1).get()) {
                acquired++;
            }
        }
        assertThat(acquired, is(1));
    }

    @Test
    public void acquireIsIdempotentForSameHolderAndGeneration()
            throws Exception
    {
        assertThat(locks.tryAcquire("job", "a", LEASE, 1).get(), is(true));
        assertThat(locks.tryAcquire("job", "a", LEASE, 1).get(), is(true));
        assertThat(locks.tryAcquire("job", "a", LEASE, 2).get(), is(false));
    }

    @Test
    public void lockExpiresWithLease()
            throws Exception
    {
        assertThat(locks.tryAcquire("job", "a", LEASE, 1).get(), is(true));
        clock.advance(LEASE.minusSeconds(1));
        assertThat(locks.tryAcquire("job", "b", LEASE, 1).get(), is(false));
        clock.advance(Duration.ofSeconds(1));
        assertThat(locks.tryAcquire("job", "b", LEASE, 2).get(), is(true));
    }

    @Test
    public void releaseOnlyByHolder()
            throws Exception
    {
        locks.tryAcquire("job", "a", LEASE, 1).get();
        locks.release("job", "b").get();
        assertThat(kv.get(LockManager.lockKey("job")).isPresent(), is(true));

        locks.release("job", "a").get();
        assertThat(kv.get(LockManager.lockKey("job")).isPresent(), is(false));
        assertThat(locks.tryAcquire("job", "b", LEASE, 1).get(), is(true));
    }

    @Test
    public void watermarkAdvancesOnlyForward()
            throws Exception
    {
        assertThat(locks.markFired("job", 1).get(), is(true));
        assertThat(locks.markFired("job", 1).get(), is(false));
        assertThat(locks.markFired("job", 3).get(), is(true));
        assertThat(locks.markFired("job", 2).get(), is(false));
        assertThat(kv.get(LockManager.firedKey("job")).get().getValue(), is("3"));
    }

    @Test
    public void discardRemovesLockAndWatermark()
            throws Exception
    {
        locks.tryAcquire("job", "a", LEASE, 1).get();
        locks.markFired("job", 1).get();
        locks.discard("job").get();
        assertThat(kv.get(LockManager.lockKey("job")).isPresent(), is(false));
        assertThat(kv.get(LockManager.firedKey("job")).isPresent(), is(false));
    }

    @Test
    public void substrateFailuresAreRetried()
            throws Exception
    {
        KeyValueStore flaky = mock(KeyValueStore.class);
        when(flaky.create(eq("lock.job"), anyString(), any()))
            .thenThrow(new SubstrateException("connection reset"))
            .thenReturn(true);

        assertThat(locksOn(flaky).tryAcquire("job", "a", LEASE, 1).get(), is(true));
        verify(flaky, times(2)).create(eq("lock.job"), anyString(), any());
    }

    @Test
    public void giveUpWhenSubstrateStaysDown()
            throws Exception
    {
        KeyValueStore down = mock(KeyValueStore.class);
        when(down.create(anyString(), anyString(), any())).thenThrow(new SubstrateException("down"));
        when(down.get(anyString())).thenThrow(new SubstrateException("down"));

        CompletableFuture<Boolean> acquire = locksOn(down).tryAcquire("job", "a", LEASE, 1);
        try {
            acquire.get();
            throw new AssertionError("acquire must fail");
        }
        catch (ExecutionException ex) {
            assertThat(ex.getCause(), instanceOf(RetryGiveupException.class));
        }
        verify(down, times(3)).create(anyString(), anyString(), any());

        // release never fails
        locksOn(down).release("job", "a").get();
    }

    @Test
    public void unreadableLockEntryFails()
            throws Exception
    {
        kv.create(LockManager.lockKey("job"), "not json", Optional.absent());
        CompletableFuture<Boolean> acquire = locks.tryAcquire("job", "a", LEASE, 1);
        try {
            acquire.get();
            throw new AssertionError("acquire must fail");
        }
        catch (ExecutionException ex) {
            assertThat(ex.getCause(), instanceOf(RetryGiveupException.class));
        }
    }
}
