package io.cronlattice.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import com.fasterxml.jackson.module.guice.ObjectMapperModule;
import com.google.common.base.Function;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.TypeLiteral;
import com.google.inject.util.Modules;
import io.cronlattice.core.config.Config;
import io.cronlattice.core.config.ConfigException;
import io.cronlattice.core.config.ConfigFactory;
import io.cronlattice.core.config.ObjectMappers;
import io.cronlattice.core.config.PropertyUtils;
import io.cronlattice.core.database.DatabaseSubstrateModule;
import io.cronlattice.core.memory.MemorySubstrateModule;
import io.cronlattice.core.provider.CronProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds an injector holding a cron provider and its substrate, and runs
 * the background services of it until closed.
 *
 * A {@link io.cronlattice.spi.Dispatcher} must be bound by an additional
 * module.
 */
public class CronLatticeEmbed
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(CronLatticeEmbed.class);

    public static class Bootstrap
    {
        private final List<Function<? super List<Module>, ? extends Iterable<? extends Module>>> moduleOverrides = new ArrayList<>();
        private Properties systemConfig = new Properties();

        public Bootstrap addModules(Module... additionalModules)
        {
            return addModules(Arrays.asList(additionalModules));
        }

        public Bootstrap addModules(Iterable<? extends Module> additionalModules)
        {
            final List<Module> copy = ImmutableList.copyOf(additionalModules);
            return overrideModules(modules -> Iterables.concat(modules, copy));
        }

        public Bootstrap overrideModules(Function<? super List<Module>, ? extends Iterable<? extends Module>> function)
        {
            moduleOverrides.add(function);
            return this;
        }

        public Bootstrap overrideModulesWith(Module... overridingModules)
        {
            return overrideModulesWith(Arrays.asList(overridingModules));
        }

        public Bootstrap overrideModulesWith(Iterable<? extends Module> overridingModules)
        {
            return overrideModules(modules -> ImmutableList.of(Modules.override(modules).with(overridingModules)));
        }

        public Bootstrap setSystemConfig(Properties systemConfig)
        {
            this.systemConfig = systemConfig;
            return this;
        }

        public CronLatticeEmbed initialize()
        {
            return build(true);
        }

        public CronLatticeEmbed initializeWithoutShutdownHook()
        {
            return build(false);
        }

        private CronLatticeEmbed build(boolean destroyOnShutdownHook)
        {
            List<Module> modules = standardModules();
            for (Function<? super List<Module>, ? extends Iterable<? extends Module>> override : moduleOverrides) {
                modules = ImmutableList.copyOf(override.apply(modules));
            }
            Injector injector = Guice.createInjector(modules);

            CronLatticeEmbed embed = new CronLatticeEmbed(injector);
            try {
                embed.start();
            }
            catch (RuntimeException ex) {
                try {
                    embed.close();
                }
                catch (RuntimeException closeError) {
                    ex.addSuppressed(closeError);
                }
                throw ex;
            }
            if (destroyOnShutdownHook) {
                Runtime.getRuntime().addShutdownHook(new Thread(() -> embed.close(), "shutdown-cronlattice"));
            }
            return embed;
        }

        private List<Module> standardModules()
        {
            Properties props = systemConfig;
            ImmutableList.Builder<Module> builder = ImmutableList.builder();
            builder.add(new ObjectMapperModule()
                    .withObjectMapper(ObjectMappers.objectMapper()));
            builder.add(substrateModule(props.getProperty("substrate.type", "memory")));
            builder.add(new SchedulerModule());
            builder.add((binder) -> {
                binder.bind(Properties.class).toInstance(props);
                binder.bind(Config.class).toProvider(SystemConfigProvider.class);
            });
            return builder.build();
        }
    }

    static Module substrateModule(String type)
    {
        switch (type) {
        case "memory":
            return new MemorySubstrateModule();
        case "database":
            return new DatabaseSubstrateModule();
        default:
            throw new ConfigException("Unknown substrate.type: " + type);
        }
    }

    public static class SystemConfigProvider
            implements Provider<Config>
    {
        private final Config systemConfig;

        @Inject
        public SystemConfigProvider(Properties props, ConfigFactory cf)
        {
            this.systemConfig = PropertyUtils.toConfig(cf, props);
        }

        @Override
        public Config get()
        {
            return systemConfig;
        }
    }

    private final Injector injector;
    private final List<BackgroundService> services;
    private boolean closed = false;

    CronLatticeEmbed(Injector injector)
    {
        this.injector = injector;
        this.services = ImmutableList.copyOf(
                injector.getInstance(Key.get(new TypeLiteral<Set<BackgroundService>>() { })));
    }

    private void start()
    {
        for (BackgroundService service : services) {
            service.start();
        }
    }

    public Injector getInjector()
    {
        return injector;
    }

    public CronProvider getCronProvider()
    {
        return injector.getInstance(CronProvider.class);
    }

    @Override
    public synchronized void close()
    {
        if (closed) {
            return;
        }
        closed = true;

        RuntimeException error = null;
        for (BackgroundService service : Lists.reverse(services)) {
            try {
                service.shutdown();
            }
            catch (RuntimeException ex) {
                logger.warn("Failed to shut down {}", service.getClass().getSimpleName(), ex);
                if (error == null) {
                    error = ex;
                }
                else {
                    error.addSuppressed(ex);
                }
            }
        }
        injector.getInstance(SchedulerExecutors.class).shutdown();
        if (error != null) {
            throw error;
        }
    }
}
