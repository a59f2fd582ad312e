package io.cronlattice.core.database;

import javax.sql.DataSource;
import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.cronlattice.core.BackgroundService;
import io.cronlattice.spi.KeyValueStore;
import io.cronlattice.spi.TriggerLog;
import org.jdbi.v3.core.Jdbi;

/**
 * Stores trigger logs and locks in a shared H2 or PostgreSQL database.
 */
public class DatabaseSubstrateModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(DatabaseConfig.class).toProvider(DatabaseConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSource.class).toProvider(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(AutoMigrator.class).in(Scopes.SINGLETON);
        binder.bind(Jdbi.class).toProvider(JdbiProvider.class).in(Scopes.SINGLETON);
        binder.bind(DatabaseMigrator.class).in(Scopes.SINGLETON);
        binder.bind(DatabaseTriggerLog.class).in(Scopes.SINGLETON);
        binder.bind(TriggerLog.class).to(DatabaseTriggerLog.class);
        binder.bind(KeyValueStore.class).to(DatabaseKeyValueStore.class).in(Scopes.SINGLETON);

        // the poller starts before the scheduler and the data source closes last
        Multibinder<BackgroundService> services = Multibinder.newSetBinder(binder, BackgroundService.class);
        services.addBinding().to(DataSourceProvider.class);
        services.addBinding().to(DatabaseTriggerLog.class);
    }
}
