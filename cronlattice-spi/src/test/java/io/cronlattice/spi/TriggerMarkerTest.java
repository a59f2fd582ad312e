package io.cronlattice.spi;

import java.time.Instant;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class TriggerMarkerTest
{
    private static final Instant FIRE_AT = Instant.parse("2024-01-15T10:00:05Z");

    @Test
    public void expiresAtFireTime()
    {
        TriggerMarker marker = TriggerMarker.of("orders.cron.tick", 1, FIRE_AT, FIRE_AT.minusSeconds(5));
        assertThat(marker.isExpiredAt(FIRE_AT.minusMillis(1)), is(false));
        assertThat(marker.isExpiredAt(FIRE_AT), is(true));
        assertThat(marker.isExpiredAt(FIRE_AT.plusSeconds(60)), is(true));
    }
}
