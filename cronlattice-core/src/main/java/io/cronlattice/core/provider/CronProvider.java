package io.cronlattice.core.provider;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.cronlattice.core.BackgroundService;
import io.cronlattice.core.SchedulerConfig;
import io.cronlattice.core.job.CatalogError;
import io.cronlattice.core.job.JobCatalog;
import io.cronlattice.core.job.JobCatalogParser;
import io.cronlattice.core.job.JobDefinition;
import io.cronlattice.core.job.JobId;
import io.cronlattice.core.job.JobRegistry;
import io.cronlattice.core.job.LinkId;
import io.cronlattice.core.job.RegistryChange;
import io.cronlattice.core.loop.LoopState;
import io.cronlattice.core.loop.SchedulerLoop;
import io.cronlattice.core.loop.SchedulerLoopFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives link configurations and keeps one scheduler loop running per
 * registered job.
 *
 * Loops run only between {@link #start()} and {@link #shutdown()}. Links
 * received before start are registered and their loops start with the
 * provider.
 */
public class CronProvider
        implements BackgroundService
{
    private static final Logger logger = LoggerFactory.getLogger(CronProvider.class);

    public static final String CRONJOBS_PROPERTY = "cronjobs";
    public static final String SCHEDULER_INTERFACE = "scheduler";

    private final JobCatalogParser parser;
    private final JobRegistry registry;
    private final SchedulerLoopFactory loopFactory;
    private final SchedulerConfig config;

    private final Map<JobId, SchedulerLoop> loops = new LinkedHashMap<>();
    private boolean started = false;

    @Inject
    public CronProvider(JobCatalogParser parser, JobRegistry registry,
            SchedulerLoopFactory loopFactory, SchedulerConfig config)
    {
        this.parser = parser;
        this.registry = registry;
        this.loopFactory = loopFactory;
        this.config = config;
    }

    @Override
    public synchronized void start()
    {
        if (!config.getEnabled()) {
            logger.debug("Scheduler is disabled.");
            return;
        }
        if (started) {
            return;
        }
        started = true;
        for (JobDefinition job : registry.list()) {
            startLoop(job);
        }
        logger.info("Cron provider {} started with {} jobs", config.getInstanceId(), loops.size());
    }

    @Override
    public synchronized void shutdown()
    {
        if (!started) {
            return;
        }
        started = false;
        for (SchedulerLoop loop : loops.values()) {
            loop.stop();
        }
        loops.clear();
        logger.info("Cron provider {} stopped", config.getInstanceId());
    }

    /**
     * Applies a link configuration.
     *
     * @return the parsed catalog, or absent if the link is not a scheduler
     *         link or has no {@value #CRONJOBS_PROPERTY} property
     */
    public synchronized Optional<JobCatalog> receiveLinkConfig(LinkConfig link)
    {
        if (!link.getInterfaces().contains(SCHEDULER_INTERFACE)) {
            logger.debug("Ignoring link {} of {}: it does not use the {} interface",
                    link.getLinkName(), link.getTargetId(), SCHEDULER_INTERFACE);
            return Optional.absent();
        }
        Optional<String> text = link.getProperty(CRONJOBS_PROPERTY);
        if (!text.isPresent()) {
            logger.warn("Link {} of {} has no '{}' property. No jobs are scheduled for it",
                    link.getLinkName(), link.getTargetId(), CRONJOBS_PROPERTY);
            return Optional.absent();
        }

        JobCatalog catalog = parser.parse(link.getLinkId(), text.get());
        for (CatalogError error : catalog.getErrors()) {
            logger.warn("Rejected cron job entry '{}' of link {} of {}: {}",
                    error.getEntry(), link.getLinkName(), link.getTargetId(), error.getMessage());
        }
        if (catalog.getJobs().isEmpty() && catalog.hasErrors()) {
            logger.error("No cron job of link {} of {} is valid", link.getLinkName(), link.getTargetId());
        }

        RegistryChange change = registry.replaceLink(link.getLinkId(), catalog.getJobs());
        apply(change);
        logger.info("Link {} of {} has {} cron jobs ({} added, {} removed, {} unchanged)",
                link.getLinkName(), link.getTargetId(), catalog.getJobs().size(),
                change.getAdded().size(), change.getRemoved().size(), change.getUnchanged().size());
        return Optional.of(catalog);
    }

    public synchronized RegistryChange deleteLink(String targetId, String linkName)
    {
        RegistryChange change = registry.removeLink(LinkId.of(targetId, linkName));
        apply(change);
        logger.info("Link {} of {} is deleted. {} cron jobs removed",
                linkName, targetId, change.getRemoved().size());
        return change;
    }

    public List<JobDefinition> getJobs()
    {
        return registry.list();
    }

    public synchronized Optional<LoopState> getLoopState(JobId id)
    {
        SchedulerLoop loop = loops.get(id);
        if (loop == null) {
            return Optional.absent();
        }
        return Optional.of(loop.getState());
    }

    synchronized List<SchedulerLoop> getLoops()
    {
        return new ArrayList<>(loops.values());
    }

    private void apply(RegistryChange change)
    {
        for (JobDefinition removed : change.getRemoved()) {
            SchedulerLoop loop = loops.remove(removed.getId());
            if (loop != null) {
                loop.remove();
            }
        }
        if (!started) {
            return;
        }
        for (JobDefinition added : change.getAdded()) {
            startLoop(added);
        }
    }

    private void startLoop(JobDefinition job)
    {
        SchedulerLoop loop = loopFactory.create(job);
        loops.put(job.getId(), loop);
        loop.start();
    }
}
