package io.cronlattice.cli;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.Properties;
import com.beust.jcommander.Parameter;
import io.cronlattice.core.job.CatalogError;
import io.cronlattice.core.job.JobCatalog;
import io.cronlattice.core.job.JobCatalogParser;
import io.cronlattice.core.job.JobDefinition;
import io.cronlattice.core.job.LinkId;
import io.cronlattice.core.provider.CronProvider;
import io.cronlattice.core.schedule.ScheduleClassifier;
import io.cronlattice.core.schedule.ScheduleKind;

import static io.cronlattice.cli.SystemExitException.systemExit;

/**
 * Parses a cron job catalog and shows how each job would be scheduled.
 */
public class Check
    extends Command
{
    private static final int SHOWN_FIRES = 3;

    @Parameter(names = {"--cronjobs"})
    String cronjobsPath = null;

    Clock clock = Clock.systemUTC();

    @Override
    public void main()
            throws Exception
    {
        String text;
        switch (args.size()) {
        case 0:
            if (cronjobsPath != null) {
                text = new String(Files.readAllBytes(Paths.get(cronjobsPath)), StandardCharsets.UTF_8);
            }
            else {
                Properties props = loadSystemProperties();
                if (!props.containsKey(CronProvider.CRONJOBS_PROPERTY)) {
                    throw usage("--cronjobs option, cronjobs property or an entry argument is required");
                }
                text = props.getProperty(CronProvider.CRONJOBS_PROPERTY);
            }
            break;
        case 1:
            text = args.get(0);
            break;
        default:
            throw usage(null);
        }

        JobCatalog catalog = new JobCatalogParser(new ScheduleClassifier(clock))
            .parse(LinkId.of("local", "check"), text);
        show(catalog);
        if (catalog.hasErrors()) {
            throw systemExit(catalog.getErrors().size() + " entries are rejected");
        }
    }

    private void show(JobCatalog catalog)
    {
        Instant now = clock.instant();
        for (JobDefinition job : catalog.getJobs()) {
            ScheduleKind kind = job.getScheduleKind();
            out.println(job.getId().getJobName() + ": " + job.getCronExpression());
            out.println("  kind: " + kind);
            out.println("  payload: " + job.getPayload());
            Instant next = now;
            for (int i = 0; i < SHOWN_FIRES; i++) {
                next = kind.nextFire(next);
                out.println("  next: " + next);
            }
        }
        for (CatalogError error : catalog.getErrors()) {
            out.println("rejected: " + error.getEntry());
            out.println("  error: " + error.getMessage());
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " check [name=expr[:payload]] [options...]");
        err.println("  Options:");
        err.println("        --cronjobs PATH              file of cron jobs to check");
        Main.showCommonOptions(err);
        return systemExit(error);
    }
}
