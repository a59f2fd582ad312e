package io.cronlattice.core.substrate;

import java.time.Duration;
import io.cronlattice.core.config.Config;
import io.cronlattice.core.config.ConfigException;
import org.immutables.value.Value;

@Value.Immutable
public interface SubstrateConfig
{
    String getType();

    Duration getPollInterval();

    static ImmutableSubstrateConfig.Builder defaultBuilder()
    {
        return ImmutableSubstrateConfig.builder()
            .type("memory")
            .pollInterval(Duration.ofMillis(200));
    }

    static SubstrateConfig convertFrom(Config config)
    {
        int pollMillis = config.get("substrate.poll_interval", int.class, 200);
        if (pollMillis <= 0) {
            throw new ConfigException("substrate.poll_interval must be positive but got " + pollMillis);
        }
        return defaultBuilder()
            .type(config.get("substrate.type", String.class, "memory"))
            .pollInterval(Duration.ofMillis(pollMillis))
            .build();
    }
}
