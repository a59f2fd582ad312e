package io.cronlattice.core.schedule;

import java.time.Clock;
import java.time.Duration;
import com.cronutils.model.field.CronFieldName;
import com.cronutils.model.field.expression.Always;
import com.cronutils.model.field.expression.Every;
import com.cronutils.model.field.expression.FieldExpression;
import com.cronutils.model.field.expression.On;
import com.cronutils.model.field.value.SpecialChar;
import com.google.common.base.Optional;
import com.google.inject.Inject;

import static io.cronlattice.core.schedule.CronExpression.isWildcard;

public class ScheduleClassifier
{
    private static final CronFieldName[] TIME_FIELDS = {
        CronFieldName.SECOND, CronFieldName.MINUTE, CronFieldName.HOUR,
    };
    private static final Duration[] UNITS = {
        Duration.ofSeconds(1), Duration.ofMinutes(1), Duration.ofHours(1),
    };
    private static final int[] RANGES = { 60, 60, 24 };

    private final Clock clock;

    @Inject
    public ScheduleClassifier(Clock clock)
    {
        this.clock = clock;
    }

    public ScheduleKind classify(String expression)
    {
        CronExpression cron = CronExpression.parse(expression);
        Optional<Duration> period = fixedPeriodOf(cron);
        if (period.isPresent()) {
            return ScheduleKind.fixedInterval(period.get());
        }
        ScheduleKind.Complex complex = ScheduleKind.complex(cron);
        // rejects expressions like Feb 30 up front
        complex.nextFire(clock.instant());
        return complex;
    }

    static Optional<Duration> fixedPeriodOf(CronExpression cron)
    {
        if (!isWildcard(cron.getField(CronFieldName.DAY_OF_MONTH)) ||
                !isWildcard(cron.getField(CronFieldName.MONTH)) ||
                !isWildcard(cron.getField(CronFieldName.DAY_OF_WEEK))) {
            return Optional.absent();
        }

        int pivot = 0;
        while (pivot < TIME_FIELDS.length && isZero(cron.getField(TIME_FIELDS[pivot]))) {
            pivot++;
        }
        if (pivot == TIME_FIELDS.length) {
            return Optional.of(Duration.ofDays(1));
        }

        Optional<Integer> step = epochStepOf(cron.getField(TIME_FIELDS[pivot]));
        if (!step.isPresent() || RANGES[pivot] % step.get() != 0) {
            return Optional.absent();
        }
        for (int i = pivot + 1; i < TIME_FIELDS.length; i++) {
            if (!(cron.getField(TIME_FIELDS[i]) instanceof Always)) {
                return Optional.absent();
            }
        }
        return Optional.of(UNITS[pivot].multipliedBy(step.get()));
    }

    private static boolean isZero(FieldExpression field)
    {
        if (!(field instanceof On)) {
            return false;
        }
        On on = (On) field;
        return on.getSpecialChar().getValue() == SpecialChar.NONE && on.getTime().getValue() == 0;
    }

    /**
     * Step of a field that matches every n-th value counted from zero:
     * 1 for {@code *}, n for {@code *}/n and {@code 0/n}.
     */
    private static Optional<Integer> epochStepOf(FieldExpression field)
    {
        if (field instanceof Always) {
            return Optional.of(1);
        }
        if (field instanceof Every) {
            Every every = (Every) field;
            if (every.getExpression() instanceof Always || isZero(every.getExpression())) {
                return Optional.of(every.getPeriod().getValue());
            }
        }
        return Optional.absent();
    }
}
