package io.cronlattice.core;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.cronlattice.core.config.Config;

public class SchedulerConfigProvider
        implements Provider<SchedulerConfig>
{
    private final SchedulerConfig config;

    @Inject
    public SchedulerConfigProvider(Config systemConfig)
    {
        this.config = SchedulerConfig.convertFrom(systemConfig);
    }

    @Override
    public SchedulerConfig get()
    {
        return config;
    }
}
