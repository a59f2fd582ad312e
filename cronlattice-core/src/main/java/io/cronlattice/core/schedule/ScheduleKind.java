package io.cronlattice.core.schedule;

import java.time.Duration;
import java.time.Instant;
import com.google.common.base.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * How the next fire time of a job is computed.
 *
 * {@link FixedInterval} schedules fire on the epoch-aligned grid
 * {@code k * period}; any instance computes the same instant from wall
 * time alone. {@link Complex} schedules scan the cron expression forward.
 */
public abstract class ScheduleKind
{
    private ScheduleKind()
    { }

    public static FixedInterval fixedInterval(Duration period)
    {
        return new FixedInterval(period);
    }

    public static Complex complex(CronExpression expression)
    {
        return new Complex(expression);
    }

    /**
     * Returns the first fire time strictly after {@code now}.
     *
     * @throws UnmatchableScheduleException if the schedule never matches
     */
    public abstract Instant nextFire(Instant now);

    public abstract boolean isFixedInterval();

    public Optional<Duration> getPeriod()
    {
        return Optional.absent();
    }

    public static final class FixedInterval
            extends ScheduleKind
    {
        private final Duration period;

        private FixedInterval(Duration period)
        {
            checkArgument(!period.isNegative() && !period.isZero(), "period must be positive");
            checkArgument(period.getNano() == 0, "period must be whole seconds");
            this.period = period;
        }

        @Override
        public Instant nextFire(Instant now)
        {
            long periodSeconds = period.getSeconds();
            long k = Math.floorDiv(now.getEpochSecond(), periodSeconds);
            return Instant.ofEpochSecond((k + 1) * periodSeconds);
        }

        @Override
        public boolean isFixedInterval()
        {
            return true;
        }

        @Override
        public Optional<Duration> getPeriod()
        {
            return Optional.of(period);
        }

        @Override
        public boolean equals(Object o)
        {
            return o instanceof FixedInterval && period.equals(((FixedInterval) o).period);
        }

        @Override
        public int hashCode()
        {
            return period.hashCode();
        }

        @Override
        public String toString()
        {
            return "FixedInterval{period=" + period + "}";
        }
    }

    public static final class Complex
            extends ScheduleKind
    {
        private final CronExpression expression;

        private Complex(CronExpression expression)
        {
            this.expression = expression;
        }

        public CronExpression getExpression()
        {
            return expression;
        }

        @Override
        public Instant nextFire(Instant now)
        {
            Optional<Instant> next = expression.nextMatch(now);
            if (!next.isPresent()) {
                throw new UnmatchableScheduleException(
                        "Cron expression '" + expression + "' does not match any time within " +
                        CronExpression.SEARCH_HORIZON_YEARS + " years after " + now);
            }
            return next.get();
        }

        @Override
        public boolean isFixedInterval()
        {
            return false;
        }

        @Override
        public boolean equals(Object o)
        {
            return o instanceof Complex && expression.equals(((Complex) o).expression);
        }

        @Override
        public int hashCode()
        {
            return expression.hashCode();
        }

        @Override
        public String toString()
        {
            return "Complex{expression=" + expression + "}";
        }
    }
}
