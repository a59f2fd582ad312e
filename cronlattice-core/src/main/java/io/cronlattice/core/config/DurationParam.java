package io.cronlattice.core.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public class DurationParam
{
    private final Duration duration;

    private DurationParam(Duration duration)
    {
        this.duration = duration;
    }

    public Duration getDuration()
    {
        return duration;
    }

    @JsonCreator
    public static DurationParam parse(String expr)
    {
        try {
            return new DurationParam(Durations.parseDuration(expr));
        }
        catch (DateTimeParseException ex) {
            throw new ConfigException("Invalid duration '" + expr + "'", ex);
        }
    }

    public static DurationParam of(Duration duration)
    {
        return new DurationParam(duration);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return duration.equals(((DurationParam) o).duration);
    }

    @Override
    public int hashCode()
    {
        return duration.hashCode();
    }

    @Override
    @JsonValue
    public String toString()
    {
        return Durations.formatDuration(duration);
    }
}
