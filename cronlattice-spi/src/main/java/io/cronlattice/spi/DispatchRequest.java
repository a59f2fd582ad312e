package io.cronlattice.spi;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.immutables.value.Value;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

@Value.Immutable
@JsonSerialize(as = ImmutableDispatchRequest.class)
@JsonDeserialize(as = ImmutableDispatchRequest.class)
public interface DispatchRequest
{
    String getTargetId();

    String getLinkName();

    String getJobName();

    /**
     * The fire time of the occurrence being dispatched.
     */
    Instant getScheduledTime();

    /**
     * The payload configured for the job, passed through verbatim.
     */
    String getPayload();

    default byte[] payloadBytes()
    {
        return getPayload().getBytes(StandardCharsets.UTF_8);
    }
}
