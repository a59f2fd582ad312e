package io.cronlattice.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import com.beust.jcommander.Parameter;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Scopes;
import io.cronlattice.core.CronLatticeEmbed;
import io.cronlattice.core.job.JobCatalog;
import io.cronlattice.core.provider.CronProvider;
import io.cronlattice.core.provider.ImmutableLinkConfig;
import io.cronlattice.core.provider.LinkConfig;
import io.cronlattice.spi.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.cronlattice.cli.SystemExitException.systemExit;

public class Run
    extends Command
{
    private static final Logger logger = LoggerFactory.getLogger(Run.class);

    @Parameter(names = {"--cronjobs"})
    String cronjobsPath = null;

    @Parameter(names = {"--target"})
    String targetId = "local";

    @Parameter(names = {"--link"})
    String linkName = "cron";

    @Override
    public void main()
            throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }
        Properties props = loadSystemProperties();
        LinkConfig link = buildLinkConfig(props);

        CountDownLatch closed = new CountDownLatch(1);
        CronLatticeEmbed embed = buildEmbed(props, out);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                embed.close();
            }
            finally {
                closed.countDown();
            }
        }, "shutdown-cronlattice"));

        CronProvider provider = embed.getCronProvider();
        Optional<JobCatalog> catalog = provider.receiveLinkConfig(link);
        if (!catalog.isPresent() || catalog.get().getJobs().isEmpty()) {
            embed.close();
            throw systemExit("No valid cron jobs are configured");
        }
        logger.info("Scheduling {} cron jobs. Press Ctrl-C to stop", catalog.get().getJobs().size());
        closed.await();
    }

    static CronLatticeEmbed buildEmbed(Properties props, PrintStream out)
    {
        return new CronLatticeEmbed.Bootstrap()
            .setSystemConfig(props)
            .addModules(binder -> {
                binder.bind(PrintStream.class).annotatedWith(StdOut.class).toInstance(out);
                binder.bind(Dispatcher.class).to(LoggingDispatcher.class).in(Scopes.SINGLETON);
            })
            .initializeWithoutShutdownHook();
    }

    LinkConfig buildLinkConfig(Properties props)
            throws IOException, SystemExitException
    {
        String cronjobs;
        if (cronjobsPath != null) {
            cronjobs = new String(Files.readAllBytes(Paths.get(cronjobsPath)), StandardCharsets.UTF_8);
        }
        else if (props.containsKey(CronProvider.CRONJOBS_PROPERTY)) {
            cronjobs = props.getProperty(CronProvider.CRONJOBS_PROPERTY);
        }
        else {
            throw usage("--cronjobs option or cronjobs property is required");
        }
        return ImmutableLinkConfig.builder()
            .targetId(targetId)
            .linkName(linkName)
            .interfaces(ImmutableSet.of(CronProvider.SCHEDULER_INTERFACE))
            .properties(ImmutableMap.of(CronProvider.CRONJOBS_PROPERTY, cronjobs))
            .build();
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " run [options...]");
        err.println("  Options:");
        err.println("        --cronjobs PATH              file of cron jobs (name=expr[:payload] per line)");
        err.println("        --target ID                  target id of the jobs (default: local)");
        err.println("        --link NAME                  link name of the jobs (default: cron)");
        Main.showCommonOptions(err);
        return systemExit(error);
    }
}
