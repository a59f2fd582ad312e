package io.cronlattice.core.substrate;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.cronlattice.core.config.Config;

public class SubstrateConfigProvider
        implements Provider<SubstrateConfig>
{
    private final SubstrateConfig config;

    @Inject
    public SubstrateConfigProvider(Config systemConfig)
    {
        this.config = SubstrateConfig.convertFrom(systemConfig);
    }

    @Override
    public SubstrateConfig get()
    {
        return config;
    }
}
