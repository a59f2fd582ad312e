package io.cronlattice.core.database;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.cronlattice.core.config.Config;

public class DatabaseConfigProvider
        implements Provider<DatabaseConfig>
{
    private final DatabaseConfig config;

    @Inject
    public DatabaseConfigProvider(Config systemConfig)
    {
        this.config = DatabaseConfig.convertFrom(systemConfig);
    }

    @Override
    public DatabaseConfig get()
    {
        return config;
    }
}
