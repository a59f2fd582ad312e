package io.cronlattice.core;

import java.util.List;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.cronlattice.core.config.ConfigException;
import io.cronlattice.core.database.DatabaseKeyValueStore;
import io.cronlattice.core.job.JobId;
import io.cronlattice.core.memory.MemoryTriggerLog;
import io.cronlattice.core.provider.CronProvider;
import io.cronlattice.core.provider.ImmutableLinkConfig;
import io.cronlattice.core.provider.LinkConfig;
import io.cronlattice.spi.DispatchRequest;
import io.cronlattice.spi.Dispatcher;
import io.cronlattice.spi.KeyValueStore;
import io.cronlattice.spi.TriggerLog;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertTrue;

public class CronLatticeEmbedTest
{
    private final List<DispatchRequest> dispatched = new CopyOnWriteArrayList<>();
    private final CountDownLatch firstDispatch = new CountDownLatch(1);

    private CronLatticeEmbed embed(Properties props)
    {
        Dispatcher dispatcher = request -> {
            dispatched.add(request);
            firstDispatch.countDown();
        };
        return new CronLatticeEmbed.Bootstrap()
            .setSystemConfig(props)
            .addModules(binder -> binder.bind(Dispatcher.class).toInstance(dispatcher))
            .initializeWithoutShutdownHook();
    }

    private static LinkConfig everySecond()
    {
        return ImmutableLinkConfig.builder()
            .targetId("orders")
            .linkName("cron")
            .interfaces(ImmutableSet.of(CronProvider.SCHEDULER_INTERFACE))
            .properties(ImmutableMap.of(CronProvider.CRONJOBS_PROPERTY, "tick=* * * * * *:{\"n\":1}"))
            .build();
    }

    private static Properties props(String... pairs)
    {
        Properties props = new Properties();
        for (int i = 0; i < pairs.length; i += 2) {
            props.setProperty(pairs[i], pairs[i + 1]);
        }
        return props;
    }

    @Test
    public void dispatchesWithMemorySubstrate()
            throws Exception
    {
        try (CronLatticeEmbed embed = embed(props("scheduler.instance_id", "embed-test", "substrate.poll_interval", "50"))) {
            assertThat(embed.getInjector().getInstance(TriggerLog.class), instanceOf(MemoryTriggerLog.class));
            CronProvider provider = embed.getCronProvider();
            provider.receiveLinkConfig(everySecond());

            assertTrue(firstDispatch.await(10, TimeUnit.SECONDS));
            DispatchRequest request = dispatched.get(0);
            assertThat(request.getJobName(), is("tick"));
            assertThat(request.getPayload(), is("{\"n\":1}"));
            assertThat(request.getScheduledTime().getNano(), is(0));
            assertThat(provider.getLoopState(JobId.of("orders", "cron", "tick")).isPresent(), is(true));
        }
    }

    @Test
    public void dispatchesWithDatabaseSubstrate()
            throws Exception
    {
        Properties props = props(
                "substrate.type", "database",
                "substrate.poll_interval", "50",
                "database.type", "memory");
        try (CronLatticeEmbed embed = embed(props)) {
            assertThat(embed.getInjector().getInstance(KeyValueStore.class), instanceOf(DatabaseKeyValueStore.class));
            embed.getCronProvider().receiveLinkConfig(everySecond());
            assertTrue(firstDispatch.await(10, TimeUnit.SECONDS));
        }
    }

    @Test
    public void closeStopsLoops()
    {
        CronLatticeEmbed embed = embed(props("scheduler.instance_id", "embed-test"));
        CronProvider provider = embed.getCronProvider();
        provider.receiveLinkConfig(everySecond());
        JobId id = JobId.of("orders", "cron", "tick");
        assertThat(provider.getLoopState(id).isPresent(), is(true));

        embed.close();
        assertThat(provider.getLoopState(id).isPresent(), is(false));
        // closing twice is harmless
        embed.close();
    }

    @Test(expected = ConfigException.class)
    public void unknownSubstrateTypeIsRejected()
    {
        embed(props("substrate.type", "etcd"));
    }
}
