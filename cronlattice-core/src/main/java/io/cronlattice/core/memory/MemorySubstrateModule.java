package io.cronlattice.core.memory;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.cronlattice.core.BackgroundService;
import io.cronlattice.spi.KeyValueStore;
import io.cronlattice.spi.TriggerLog;

/**
 * Keeps trigger logs and locks in this process. Only useful for a single
 * instance and for tests.
 */
public class MemorySubstrateModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(MemoryTriggerLog.class).in(Scopes.SINGLETON);
        binder.bind(TriggerLog.class).to(MemoryTriggerLog.class);
        binder.bind(KeyValueStore.class).to(MemoryKeyValueStore.class).in(Scopes.SINGLETON);
        Multibinder.newSetBinder(binder, BackgroundService.class)
            .addBinding().to(MemoryTriggerLog.class);
    }
}
