package io.cronlattice.core;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;

/**
 * Thread pools shared by all scheduler loops of a provider.
 */
public class SchedulerExecutors
{
    private final Executor substrateExecutor;
    private final Executor dispatchExecutor;
    private final ScheduledExecutorService timer;

    @Inject
    public SchedulerExecutors(SchedulerConfig config)
    {
        this(
                Executors.newFixedThreadPool(config.getSubstrateThreads(),
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("scheduler-substrate-%d")
                    .build()),
                Executors.newFixedThreadPool(config.getDispatchThreads(),
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("scheduler-dispatch-%d")
                    .build()),
                Executors.newScheduledThreadPool(1,
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("scheduler-%d")
                    .build()));
    }

    public SchedulerExecutors(Executor substrateExecutor, Executor dispatchExecutor, ScheduledExecutorService timer)
    {
        this.substrateExecutor = substrateExecutor;
        this.dispatchExecutor = dispatchExecutor;
        this.timer = timer;
    }

    public Executor getSubstrateExecutor()
    {
        return substrateExecutor;
    }

    public Executor getDispatchExecutor()
    {
        return dispatchExecutor;
    }

    /**
     * Single thread for retry waits. Tasks on it must not block.
     */
    public ScheduledExecutorService getTimer()
    {
        return timer;
    }

    public void shutdown()
    {
        shutdownIfService(substrateExecutor);
        shutdownIfService(dispatchExecutor);
        timer.shutdownNow();
    }

    private static void shutdownIfService(Executor executor)
    {
        if (executor instanceof ExecutorService) {
            ((ExecutorService) executor).shutdownNow();
        }
    }
}
