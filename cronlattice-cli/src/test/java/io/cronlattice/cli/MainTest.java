package io.cronlattice.cli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class MainTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;

    @Before
    public void setUp()
    {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
    }

    private int cli(Map<String, String> env, String... args)
            throws UnsupportedEncodingException
    {
        PrintStream out = new PrintStream(outBytes, true, "UTF-8");
        PrintStream err = new PrintStream(errBytes, true, "UTF-8");
        return new Main(env, out, err).cli(args);
    }

    private int cli(String... args)
            throws UnsupportedEncodingException
    {
        return cli(ImmutableMap.of(), args);
    }

    private String out()
    {
        return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err()
    {
        return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void showsUsageWithoutArguments()
            throws Exception
    {
        assertThat(cli(), is(0));
        assertThat(err(), containsString("Usage: cronlattice <command>"));
    }

    @Test
    public void rejectsUnknownCommand()
            throws Exception
    {
        assertThat(cli("launch"), is(1));
        assertThat(err(), containsString("error: available commands are:"));
    }

    @Test
    public void rejectsUnknownLogLevel()
            throws Exception
    {
        assertThat(cli("check", "-l", "loud", "tick=* * * * * *"), is(1));
        assertThat(err(), containsString("Unknown log level 'loud'"));
    }

    @Test
    public void checkShowsSchedule()
            throws Exception
    {
        assertThat(cli("check", "-l", "warn", "report=0 */15 * * * *:{\"format\":\"csv\"}"), is(0));
        String out = out();
        assertThat(out, containsString("report: 0 */15 * * * *"));
        assertThat(out, containsString("  kind: FixedInterval{period=PT15M}"));
        assertThat(out, containsString("  payload: {\"format\":\"csv\"}"));
        assertThat(out, containsString("  next: "));
        assertThat(out, not(containsString("rejected:")));
    }

    @Test
    public void checkReportsRejectedEntries()
            throws Exception
    {
        assertThat(cli("check", "-l", "warn", "good=0 0 * * * *;bad=0 0 25 * * *"), is(1));
        assertThat(out(), containsString("good: 0 0 * * * *"));
        assertThat(out(), containsString("rejected: bad=0 0 25 * * *"));
        assertThat(err(), containsString("error: 1 entries are rejected"));
    }

    @Test
    public void checkReadsCronjobsFile()
            throws Exception
    {
        Path file = folder.newFile("cronjobs.txt").toPath();
        Files.write(file, "a=*/5 * * * * *\nb=0 30 9 * * MON-FRI\n".getBytes(StandardCharsets.UTF_8));

        assertThat(cli("check", "-l", "warn", "--cronjobs", file.toString()), is(0));
        assertThat(out(), containsString("a: */5 * * * * *"));
        assertThat(out(), containsString("b: 0 30 9 * * MON-FRI"));
        assertThat(out(), containsString("  kind: Complex"));
    }

    @Test
    public void checkReadsCronjobsFromEnvironmentConfig()
            throws Exception
    {
        Map<String, String> env = ImmutableMap.of(Command.CONFIG_ENV, "cronjobs=nightly=0 0 3 * * *");
        assertThat(cli(env, "check", "-l", "warn"), is(0));
        assertThat(out(), containsString("nightly: 0 0 3 * * *"));
    }

    @Test
    public void checkRequiresCronjobs()
            throws Exception
    {
        assertThat(cli("check", "-l", "warn"), is(1));
        assertThat(err(), containsString("Usage: cronlattice check"));
    }

    @Test
    public void runRequiresValidJobs()
            throws Exception
    {
        assertThat(cli("run", "-l", "warn", "-X", "cronjobs=broken=* * *"), is(1));
        assertThat(err(), containsString("error: No valid cron jobs are configured"));
    }

    @Test
    public void runRequiresCronjobs()
            throws Exception
    {
        assertThat(cli("run", "-l", "warn"), is(1));
        assertThat(err(), containsString("--cronjobs option or cronjobs property is required"));
    }

    @Test
    public void migrateRunsOnce()
            throws IOException
    {
        String database = folder.newFolder("db").toString();

        assertThat(cli("migrate", "check", "-l", "warn", "-o", database), is(0));
        assertThat(out(), containsString("No table exist"));

        assertThat(cli("migrate", "run", "-l", "warn", "-o", database), is(0));
        assertThat(out(), containsString("Migrations successfully finished"));

        outBytes.reset();
        assertThat(cli("migrate", "run", "-l", "warn", "-o", database), is(0));
        assertThat(out(), containsString("No update"));

        outBytes.reset();
        assertThat(cli("migrate", "check", "-l", "warn", "-o", database), is(0));
        assertThat(out(), containsString("No update"));
    }

    @Test
    public void migrateRequiresDatabase()
            throws Exception
    {
        assertThat(cli("migrate", "run", "-l", "warn"), is(1));
        assertThat(err(), containsString("--database, or --config option is required"));
    }

    @Test
    public void formatsCausalChain()
    {
        Exception ex = new IllegalStateException("Failed to start", new RuntimeException("Connection refused"));
        assertThat(Main.formatExceptionMessage(ex), is("Failed to start: Connection refused"));
    }
}
