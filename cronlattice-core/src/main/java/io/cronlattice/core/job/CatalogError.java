package io.cronlattice.core.job;

import org.immutables.value.Value;

/**
 * A catalog entry that was rejected. The rest of the catalog is still used.
 */
@Value.Immutable
public interface CatalogError
{
    String getEntry();

    String getMessage();

    static CatalogError of(String entry, String message)
    {
        return ImmutableCatalogError.builder()
            .entry(entry)
            .message(message)
            .build();
    }
}
