package io.cronlattice.core.job;

import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
public interface JobCatalog
{
    LinkId getLinkId();

    List<JobDefinition> getJobs();

    List<CatalogError> getErrors();

    default boolean hasErrors()
    {
        return !getErrors().isEmpty();
    }
}
