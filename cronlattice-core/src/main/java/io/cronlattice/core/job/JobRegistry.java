package io.cronlattice.core.job;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Registered jobs of all links.
 *
 * Readers see an immutable snapshot and a generation number that is
 * incremented on every change, so a scheduler loop can tell that its job
 * may have been removed by comparing a single number.
 */
public class JobRegistry
{
    private static class Snapshot
    {
        private final ImmutableMap<JobId, JobDefinition> jobs;
        private final long generation;

        Snapshot(ImmutableMap<JobId, JobDefinition> jobs, long generation)
        {
            this.jobs = jobs;
            this.generation = generation;
        }
    }

    private volatile Snapshot snapshot = new Snapshot(ImmutableMap.of(), 0L);

    public synchronized RegistryChange replaceLink(LinkId link, List<JobDefinition> jobs)
    {
        Snapshot current = snapshot;
        Map<JobId, JobDefinition> next = new LinkedHashMap<>(current.jobs);

        ImmutableRegistryChange.Builder change = ImmutableRegistryChange.builder();
        Map<JobId, JobDefinition> requested = new LinkedHashMap<>();
        for (JobDefinition def : jobs) {
            if (!def.getId().getLinkId().equals(link)) {
                throw new IllegalArgumentException("Job " + def.getId() + " does not belong to link " + link);
            }
            requested.put(def.getId(), def);
        }

        for (JobDefinition old : current.jobs.values()) {
            if (!old.getId().getLinkId().equals(link)) {
                continue;
            }
            JobDefinition replacement = requested.get(old.getId());
            if (replacement == null || !replacement.equals(old)) {
                change.addRemoved(old);
                next.remove(old.getId());
            }
        }
        for (JobDefinition def : requested.values()) {
            JobDefinition old = current.jobs.get(def.getId());
            if (def.equals(old)) {
                change.addUnchanged(def);
            }
            else {
                change.addAdded(def);
                next.put(def.getId(), def);
            }
        }

        return commit(current, next, change);
    }

    public synchronized RegistryChange removeLink(LinkId link)
    {
        return replaceLink(link, ImmutableList.of());
    }

    private RegistryChange commit(Snapshot current, Map<JobId, JobDefinition> next, ImmutableRegistryChange.Builder change)
    {
        RegistryChange built = change.generation(current.generation).build();
        if (built.isEmpty()) {
            return built;
        }
        long generation = current.generation + 1;
        snapshot = new Snapshot(ImmutableMap.copyOf(next), generation);
        return ImmutableRegistryChange.builder()
            .from(built)
            .generation(generation)
            .build();
    }

    public List<JobDefinition> list()
    {
        return snapshot.jobs.values().asList();
    }

    public Optional<JobDefinition> get(JobId id)
    {
        return Optional.fromNullable(snapshot.jobs.get(id));
    }

    public long getGeneration()
    {
        return snapshot.generation;
    }

    /**
     * Returns true if this exact definition is still registered.
     */
    public boolean isCurrent(JobDefinition def)
    {
        return def.equals(snapshot.jobs.get(def.getId()));
    }
}
