package io.cronlattice.core.provider;

import java.util.Map;
import java.util.Set;
import com.google.common.base.Optional;
import io.cronlattice.core.job.LinkId;
import org.immutables.value.Value;

/**
 * Configuration of a link delivered to this provider by the lattice.
 */
@Value.Immutable
public interface LinkConfig
{
    String getTargetId();

    String getLinkName();

    /**
     * Interfaces of the provider the link uses. Only links that include
     * {@code scheduler} are handled.
     */
    Set<String> getInterfaces();

    Map<String, String> getProperties();

    default LinkId getLinkId()
    {
        return LinkId.of(getTargetId(), getLinkName());
    }

    default Optional<String> getProperty(String name)
    {
        return Optional.fromNullable(getProperties().get(name));
    }
}
