package io.cronlattice.core.trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import io.cronlattice.core.ManualClock;
import io.cronlattice.core.memory.MemoryTriggerLog;
import io.cronlattice.core.substrate.SubstrateExecutor;
import io.cronlattice.spi.TriggerMarker;
import org.junit.Test;

import static io.cronlattice.core.util.RetryExecutor.retryExecutor;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class TriggerStreamManagerTest
{
    private static final Instant START = Instant.parse("2024-01-15T10:00:00Z");

    private final ManualClock clock = new ManualClock(START);
    private final MemoryTriggerLog log = new MemoryTriggerLog(clock, Duration.ofMillis(100));
    private final SubstrateExecutor substrate = new SubstrateExecutor(
            MoreExecutors.directExecutor(), retryExecutor().withRetryLimit(0));

    private TriggerStreamManager manager()
    {
        return new TriggerStreamManager("job", log, substrate, clock);
    }

    @Test
    public void firstArmWins()
            throws Exception
    {
        TriggerStreamManager a = manager();
        TriggerStreamManager b = manager();

        assertThat(a.arm(START.plusSeconds(5), 0).get(), is(true));
        assertThat(b.arm(START.plusSeconds(5), 0).get(), is(false));
        assertThat(b.arm(START.plusSeconds(10), 1).get(), is(true));
        assertThat(a.arm(START.plusSeconds(10), 1).get(), is(false));
        assertThat(log.getLatest("job").get().getGeneration(), is(2L));
    }

    @Test
    public void hasPendingUntilExpiry()
            throws Exception
    {
        TriggerStreamManager m = manager();
        assertThat(m.hasPending().get(), is(false));
        m.arm(START.plusSeconds(5), 0).get();
        assertThat(m.hasPending().get(), is(true));
        clock.advance(Duration.ofSeconds(5));
        assertThat(m.hasPending().get(), is(false));
    }

    @Test
    public void awaitExpiryCompletesOnDelivery()
            throws Exception
    {
        TriggerStreamManager m = manager();
        m.open();
        m.arm(START.plusSeconds(5), 0).get();

        CompletableFuture<TriggerMarker> expiry = m.awaitExpiry();
        log.poll();
        assertThat(expiry.isDone(), is(false));

        clock.advance(Duration.ofSeconds(5));
        log.poll();
        assertThat(expiry.get().getGeneration(), is(1L));
    }

    @Test
    public void deliveriesBeforeAwaitAreQueued()
            throws Exception
    {
        TriggerStreamManager m = manager();
        m.open();
        m.arm(START, 0).get();
        log.poll();

        assertThat(m.awaitExpiry().get().getGeneration(), is(1L));
        assertThat(m.awaitExpiry().isDone(), is(false));
    }

    @Test
    public void closeCancelsWaiting()
    {
        TriggerStreamManager m = manager();
        m.open();
        CompletableFuture<TriggerMarker> expiry = m.awaitExpiry();
        m.close();
        assertThat(expiry.isCancelled(), is(true));

        // no delivery after close
        m.arm(START, 0);
        log.poll();
        assertThat(m.awaitExpiry().isDone(), is(false));
    }

    @Test
    public void purge()
            throws Exception
    {
        TriggerStreamManager m = manager();
        m.arm(START, 0).get();
        m.purge().get();
        assertThat(m.getLatest().get().isPresent(), is(false));
    }
}
