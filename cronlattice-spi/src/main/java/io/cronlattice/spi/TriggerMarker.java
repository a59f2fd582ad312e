package io.cronlattice.spi;

import java.time.Instant;
import org.immutables.value.Value;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * A single expiring record in a job's trigger log.
 *
 * A marker represents the next scheduled fire instant of a job. It expires
 * when {@link #getFireAt()} is reached; the expiry is what wakes up the
 * scheduler loops subscribed to the job.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableTriggerMarker.class)
@JsonDeserialize(as = ImmutableTriggerMarker.class)
public interface TriggerMarker
{
    String getJobKey();

    /**
     * Position of this marker in the job's log. The first marker of a job
     * has generation 1 and every append increases it by exactly one.
     */
    long getGeneration();

    Instant getFireAt();

    Instant getCreatedAt();

    default boolean isExpiredAt(Instant now)
    {
        return !getFireAt().isAfter(now);
    }

    static TriggerMarker of(String jobKey, long generation, Instant fireAt, Instant createdAt)
    {
        return ImmutableTriggerMarker.builder()
            .jobKey(jobKey)
            .generation(generation)
            .fireAt(fireAt)
            .createdAt(createdAt)
            .build();
    }
}
