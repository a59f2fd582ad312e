package io.cronlattice.core.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import com.google.common.base.Optional;
import io.cronlattice.core.config.ConfigException;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

public class ScheduleClassifierTest
{
    private final ScheduleClassifier classifier = new ScheduleClassifier(
            Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneOffset.UTC));

    private Optional<Duration> periodOf(String expr)
    {
        return classifier.classify(expr).getPeriod();
    }

    @Test
    public void fixedIntervals()
    {
        assertThat(periodOf("* * * * * *"), is(Optional.of(Duration.ofSeconds(1))));
        assertThat(periodOf("*/5 * * * * *"), is(Optional.of(Duration.ofSeconds(5))));
        assertThat(periodOf("0/10 * * * * *"), is(Optional.of(Duration.ofSeconds(10))));
        assertThat(periodOf("0 * * * * *"), is(Optional.of(Duration.ofMinutes(1))));
        assertThat(periodOf("0 */15 * * * *"), is(Optional.of(Duration.ofMinutes(15))));
        assertThat(periodOf("0 0 * * * *"), is(Optional.of(Duration.ofHours(1))));
        assertThat(periodOf("0 0 */6 * * *"), is(Optional.of(Duration.ofHours(6))));
        assertThat(periodOf("0 0 0 * * *"), is(Optional.of(Duration.ofDays(1))));
        assertThat(periodOf("0 0 0 * * ?"), is(Optional.of(Duration.ofDays(1))));
    }

    @Test
    public void complexSchedules()
    {
        // steps that do not divide the field range drift off the epoch grid
        assertThat(classifier.classify("*/7 * * * * *"), instanceOf(ScheduleKind.Complex.class));
        assertThat(classifier.classify("0 0 */5 * * *"), instanceOf(ScheduleKind.Complex.class));

        assertThat(classifier.classify("0 30 * * * *"), instanceOf(ScheduleKind.Complex.class));
        assertThat(classifier.classify("*/5 0 * * * *"), instanceOf(ScheduleKind.Complex.class));
        assertThat(classifier.classify("0 */15 9-17 * * *"), instanceOf(ScheduleKind.Complex.class));
        assertThat(classifier.classify("*/5 * * * * MON"), instanceOf(ScheduleKind.Complex.class));
        assertThat(classifier.classify("0 0 0 1 * *"), instanceOf(ScheduleKind.Complex.class));
    }

    @Test
    public void fixedIntervalIsAlignedToEpoch()
    {
        ScheduleKind kind = classifier.classify("*/5 * * * * *");
        assertThat(kind.nextFire(Instant.parse("2024-01-15T10:00:03Z")), is(Instant.parse("2024-01-15T10:00:05Z")));
        assertThat(kind.nextFire(Instant.parse("2024-01-15T10:00:05Z")), is(Instant.parse("2024-01-15T10:00:10Z")));
        assertThat(kind.nextFire(Instant.parse("2024-01-15T10:00:09.999Z")), is(Instant.parse("2024-01-15T10:00:10Z")));

        ScheduleKind hourly = classifier.classify("0 0 */6 * * *");
        assertThat(hourly.nextFire(Instant.parse("2024-01-15T10:00:00Z")), is(Instant.parse("2024-01-15T12:00:00Z")));
    }

    @Test
    public void complexNextFire()
    {
        ScheduleKind kind = classifier.classify("0 30 * * * *");
        assertThat(kind.nextFire(Instant.parse("2024-01-15T10:00:00Z")), is(Instant.parse("2024-01-15T10:30:00Z")));
        assertThat(kind.nextFire(Instant.parse("2024-01-15T10:30:00Z")), is(Instant.parse("2024-01-15T11:30:00Z")));
    }

    @Test
    public void rejectUnmatchableAtClassification()
    {
        try {
            classifier.classify("0 0 0 30 2 *");
            throw new AssertionError("UnmatchableScheduleException expected");
        }
        catch (UnmatchableScheduleException ex) {
            assertThat(ex, instanceOf(ConfigException.class));
        }
    }

    @Test(expected = CronExpressionException.class)
    public void rejectMalformed()
    {
        classifier.classify("every five seconds");
    }
}
