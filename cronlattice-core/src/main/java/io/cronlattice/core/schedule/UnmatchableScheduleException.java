package io.cronlattice.core.schedule;

import io.cronlattice.core.config.ConfigException;

/**
 * Thrown when a cron expression is well-formed but never matches an
 * instant within the forward-scan horizon, like {@code 0 0 0 30 2 *}.
 */
public class UnmatchableScheduleException
        extends ConfigException
{
    public UnmatchableScheduleException(String message)
    {
        super(message);
    }
}
