package io.cronlattice.spi;

import java.time.Instant;
import org.immutables.value.Value;
import com.google.common.base.Optional;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

@Value.Immutable
@JsonSerialize(as = ImmutableKeyValueEntry.class)
@JsonDeserialize(as = ImmutableKeyValueEntry.class)
public interface KeyValueEntry
{
    String getKey();

    String getValue();

    Optional<Instant> getExpiresAt();

    static KeyValueEntry of(String key, String value, Optional<Instant> expiresAt)
    {
        return ImmutableKeyValueEntry.builder()
            .key(key)
            .value(value)
            .expiresAt(expiresAt)
            .build();
    }
}
