package io.cronlattice.core.job;

import java.util.List;
import org.immutables.value.Value;

/**
 * Result of replacing the jobs of a link. A job whose definition changed
 * appears in both {@link #getRemoved()} (old definition) and
 * {@link #getAdded()} (new definition).
 */
@Value.Immutable
public interface RegistryChange
{
    List<JobDefinition> getAdded();

    List<JobDefinition> getRemoved();

    List<JobDefinition> getUnchanged();

    long getGeneration();

    default boolean isEmpty()
    {
        return getAdded().isEmpty() && getRemoved().isEmpty();
    }
}
