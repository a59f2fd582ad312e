package io.cronlattice.core.schedule;

import io.cronlattice.core.config.ConfigException;

public class CronExpressionException
        extends ConfigException
{
    public CronExpressionException(String message)
    {
        super(message);
    }

    public CronExpressionException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
