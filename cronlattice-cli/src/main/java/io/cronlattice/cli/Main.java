package io.cronlattice.cli;

import java.io.PrintStream;
import java.util.Map;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.MissingCommandException;
import com.beust.jcommander.ParameterException;
import com.google.common.base.Throwables;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.TypeLiteral;
import org.slf4j.LoggerFactory;

import static io.cronlattice.cli.SystemExitException.systemExit;

public class Main
{
    private static final String DEFAULT_PROGRAM_NAME = "cronlattice";

    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;
    private final String programName;

    public Main(Map<String, String> env, PrintStream out, PrintStream err)
    {
        this.env = env;
        this.out = out;
        this.err = err;
        this.programName = System.getProperty("io.cronlattice.cli.programName", DEFAULT_PROGRAM_NAME);
    }

    public static void main(String... args)
    {
        int code = new Main(System.getenv(), System.out, System.err).cli(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    protected void addCommands(final JCommander jc, final Injector injector)
    {
        jc.addCommand("run", injector.getInstance(Run.class), "r");
        jc.addCommand("check", injector.getInstance(Check.class), "c");
        jc.addCommand("migrate", injector.getInstance(Migrate.class));
    }

    public int cli(String... args)
    {
        if (args.length == 0) {
            usage(null);
            return 0;
        }

        boolean verbose = false;

        JCommander jc = new JCommander();
        jc.setProgramName(programName);

        Injector injector = Guice.createInjector(new AbstractModule()
        {
            @Override
            protected void configure()
            {
                bind(new TypeLiteral<Map<String, String>>() {}).annotatedWith(Environment.class).toInstance(env);
                bind(String.class).annotatedWith(ProgramName.class).toInstance(programName);
                bind(PrintStream.class).annotatedWith(StdOut.class).toInstance(out);
                bind(PrintStream.class).annotatedWith(StdErr.class).toInstance(err);
            }
        });

        addCommands(jc, injector);

        // cron expressions and payloads never refer to files
        jc.setExpandAtSign(false);
        jc.getCommands().values().forEach(c -> c.setExpandAtSign(false));

        try {
            try {
                jc.parse(args);
            }
            catch (MissingCommandException ex) {
                throw usage("available commands are: " + jc.getCommands().keySet());
            }

            Command command = getParsedCommand(jc);
            if (command == null) {
                throw usage(null);
            }

            verbose = processCommonOptions(command);

            command.main();
            return 0;
        }
        catch (ParameterException ex) {
            err.println("error: " + ex.getMessage());
            return 1;
        }
        catch (SystemExitException ex) {
            if (ex.getMessage() != null) {
                err.println("error: " + ex.getMessage());
            }
            return ex.getCode();
        }
        catch (Exception ex) {
            String message = formatExceptionMessage(ex);
            if (message.trim().isEmpty()) {
                // prevent silent crash
                ex.printStackTrace(err);
            }
            else {
                err.println("error: " + message);
                if (verbose) {
                    ex.printStackTrace(err);
                }
            }
            return 1;
        }
    }

    private static Command getParsedCommand(JCommander jc)
    {
        String commandName = jc.getParsedCommand();
        if (commandName == null) {
            return null;
        }

        return (Command) jc.getCommands().get(commandName).getObjects().get(0);
    }

    private boolean processCommonOptions(Command command)
            throws SystemExitException
    {
        if (command.help) {
            throw command.usage(null);
        }

        boolean verbose;

        switch (command.logLevel) {
        case "error":
        case "warn":
        case "info":
            verbose = false;
            break;
        case "debug":
        case "trace":
            verbose = true;
            break;
        default:
            throw usage("Unknown log level '" + command.logLevel + "'");
        }

        configureLogging(command.logLevel);

        return verbose;
    }

    private static void configureLogging(String level)
    {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();

        // logback uses system property to embed variables in XML file
        Level lv = Level.toLevel(level.toUpperCase(), Level.DEBUG);
        System.setProperty("cronlattice.log.level", lv.toString());

        try {
            configurator.doConfigure(Main.class.getResource("/cronlattice/cli/logback-console.xml"));
        }
        catch (JoranException ex) {
            throw new RuntimeException(ex);
        }
    }

    static String formatExceptionMessage(Throwable ex)
    {
        StringBuilder sb = new StringBuilder();
        for (Throwable t : Throwables.getCausalChain(ex)) {
            if (t.getMessage() == null) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(": ");
            }
            sb.append(t.getMessage());
        }
        return sb.toString();
    }

    private SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " <command> [options...]");
        err.println("  Commands:");
        err.println("    r[un] --cronjobs PATH              schedule cron jobs and print dispatches");
        err.println("    c[heck] [name=expr[:payload]]      show how cron jobs are scheduled");
        err.println("    migrate (run|check)                migrate database");
        err.println("");
        err.println("  Options:");
        showCommonOptions(err);
        if (error == null) {
            err.println("Use `<command> --help` to see detailed usage of a command.");
            return systemExit(null);
        }
        else {
            return systemExit(error);
        }
    }

    public static void showCommonOptions(PrintStream err)
    {
        err.println("    -l, --log-level LEVEL            log level (error, warn, info, debug or trace)");
        err.println("    -X KEY=VALUE                     add a system config");
        err.println("    -c, --config PATH.properties     configuration file");
        err.println("");
    }
}
