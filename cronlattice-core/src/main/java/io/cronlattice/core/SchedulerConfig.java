package io.cronlattice.core;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.UUID;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.cronlattice.core.config.Config;
import io.cronlattice.core.config.ConfigException;
import io.cronlattice.core.config.DurationParam;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableSchedulerConfig.class)
@JsonDeserialize(as = ImmutableSchedulerConfig.class)
public interface SchedulerConfig
{
    boolean getEnabled();

    /**
     * Identifies this provider instance as a lock holder.
     */
    String getInstanceId();

    Duration getLockLease();

    Duration getSubstrateTimeout();

    int getSubstrateRetryLimit();

    int getSubstrateInitialRetryWaitMillis();

    int getSubstrateMaxRetryWaitMillis();

    Duration getDispatchTimeout();

    int getSubstrateThreads();

    int getDispatchThreads();

    static ImmutableSchedulerConfig.Builder defaultBuilder()
    {
        return ImmutableSchedulerConfig.builder()
            .enabled(true)
            .instanceId(defaultInstanceId())
            .lockLease(Duration.ofSeconds(30))
            .substrateTimeout(Duration.ofSeconds(5))
            .substrateRetryLimit(3)
            .substrateInitialRetryWaitMillis(200)
            .substrateMaxRetryWaitMillis(5000)
            .dispatchTimeout(Duration.ofSeconds(30))
            .substrateThreads(4)
            .dispatchThreads(8);
    }

    static SchedulerConfig convertFrom(Config config)
    {
        ImmutableSchedulerConfig.Builder builder = defaultBuilder()
            .enabled(config.get("scheduler.enabled", boolean.class, true))
            .lockLease(durationOf(config, "scheduler.lock_lease", Duration.ofSeconds(30)))
            .substrateTimeout(durationOf(config, "scheduler.substrate_timeout", Duration.ofSeconds(5)))
            .substrateRetryLimit(config.get("scheduler.substrate_retry_limit", int.class, 3))
            .substrateInitialRetryWaitMillis(config.get("scheduler.substrate_initial_retry_wait", int.class, 200))
            .substrateMaxRetryWaitMillis(config.get("scheduler.substrate_max_retry_wait", int.class, 5000))
            .dispatchTimeout(durationOf(config, "scheduler.dispatch_timeout", Duration.ofSeconds(30)))
            .substrateThreads(config.get("scheduler.substrate_threads", int.class, 4))
            .dispatchThreads(config.get("scheduler.dispatch_threads", int.class, 8));
        if (config.has("scheduler.instance_id")) {
            builder.instanceId(config.get("scheduler.instance_id", String.class));
        }
        return builder.build();
    }

    static Duration durationOf(Config config, String key, Duration defaultValue)
    {
        Duration duration = config.get(key, DurationParam.class, DurationParam.of(defaultValue)).getDuration();
        if (duration.isNegative() || duration.isZero()) {
            throw new ConfigException("Parameter '" + key + "' must be positive but got " + DurationParam.of(duration));
        }
        return duration;
    }

    static String defaultInstanceId()
    {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        }
        catch (UnknownHostException ex) {
            host = "localhost";
        }
        return host + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Value.Check
    default void check()
    {
        if (getSubstrateRetryLimit() < 0) {
            throw new ConfigException("scheduler.substrate_retry_limit must not be negative");
        }
        if (getSubstrateThreads() < 1 || getDispatchThreads() < 1) {
            throw new ConfigException("scheduler.substrate_threads and scheduler.dispatch_threads must be positive");
        }
    }
}
