package io.cronlattice.core;

import java.time.Clock;
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.cronlattice.core.config.ConfigFactory;
import io.cronlattice.core.job.JobCatalogParser;
import io.cronlattice.core.job.JobRegistry;
import io.cronlattice.core.lock.LockManager;
import io.cronlattice.core.loop.SchedulerLoopFactory;
import io.cronlattice.core.provider.CronProvider;
import io.cronlattice.core.schedule.ScheduleClassifier;
import io.cronlattice.core.substrate.SubstrateConfig;
import io.cronlattice.core.substrate.SubstrateConfigProvider;
import io.cronlattice.core.substrate.SubstrateExecutor;

public class SchedulerModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(Clock.class).toInstance(Clock.systemUTC());
        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
        binder.bind(SchedulerConfig.class).toProvider(SchedulerConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(SubstrateConfig.class).toProvider(SubstrateConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(SchedulerExecutors.class).in(Scopes.SINGLETON);
        binder.bind(SubstrateExecutor.class).in(Scopes.SINGLETON);
        binder.bind(ScheduleClassifier.class).in(Scopes.SINGLETON);
        binder.bind(JobCatalogParser.class).in(Scopes.SINGLETON);
        binder.bind(JobRegistry.class).in(Scopes.SINGLETON);
        binder.bind(LockManager.class).in(Scopes.SINGLETON);
        binder.bind(SchedulerLoopFactory.class).in(Scopes.SINGLETON);
        binder.bind(CronProvider.class).in(Scopes.SINGLETON);

        // substrate modules add their services before this one is installed
        Multibinder.newSetBinder(binder, BackgroundService.class)
            .addBinding().to(CronProvider.class);
    }
}
