package io.cronlattice.core.loop;

import java.time.Clock;
import com.google.inject.Inject;
import io.cronlattice.core.SchedulerConfig;
import io.cronlattice.core.SchedulerExecutors;
import io.cronlattice.core.job.JobDefinition;
import io.cronlattice.core.job.JobRegistry;
import io.cronlattice.core.lock.LockManager;
import io.cronlattice.core.substrate.SubstrateExecutor;
import io.cronlattice.core.trigger.TriggerStreamManager;
import io.cronlattice.spi.Dispatcher;
import io.cronlattice.spi.TriggerLog;

public class SchedulerLoopFactory
{
    private final JobRegistry registry;
    private final TriggerLog triggerLog;
    private final LockManager locks;
    private final Dispatcher dispatcher;
    private final SubstrateExecutor substrate;
    private final SchedulerExecutors executors;
    private final SchedulerConfig config;
    private final Clock clock;

    @Inject
    public SchedulerLoopFactory(JobRegistry registry, TriggerLog triggerLog, LockManager locks,
            Dispatcher dispatcher, SubstrateExecutor substrate, SchedulerExecutors executors,
            SchedulerConfig config, Clock clock)
    {
        this.registry = registry;
        this.triggerLog = triggerLog;
        this.locks = locks;
        this.dispatcher = dispatcher;
        this.substrate = substrate;
        this.executors = executors;
        this.config = config;
        this.clock = clock;
    }

    public SchedulerLoop create(JobDefinition job)
    {
        TriggerStreamManager triggers = new TriggerStreamManager(job.getId().key(), triggerLog, substrate, clock);
        return new SchedulerLoop(job, registry, triggers, locks, dispatcher,
                executors.getDispatchExecutor(), executors.getTimer(), clock,
                config.getInstanceId(),
                config.getLockLease(),
                config.getDispatchTimeout());
    }
}
