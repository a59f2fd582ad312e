package io.cronlattice.core.lock;

import java.time.Instant;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableLockEntry.class)
@JsonDeserialize(as = ImmutableLockEntry.class)
public interface LockEntry
{
    @JsonProperty("job_key")
    String getJobKey();

    @JsonProperty("holder_id")
    String getHolderId();

    /**
     * Generation of the trigger marker whose occurrence this lock covers.
     */
    @JsonProperty("generation")
    long getGeneration();

    @JsonProperty("lease_until")
    Instant getLeaseUntil();

    static LockEntry of(String jobKey, String holderId, long generation, Instant leaseUntil)
    {
        return ImmutableLockEntry.builder()
            .jobKey(jobKey)
            .holderId(holderId)
            .generation(generation)
            .leaseUntil(leaseUntil)
            .build();
    }
}
