package io.cronlattice.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.google.inject.Inject;
import io.cronlattice.core.config.PropertyUtils;

public abstract class Command
{
    static final String CONFIG_ENV = "CRONLATTICE_CONFIG";

    @Inject @Environment protected Map<String, String> env;
    @Inject @ProgramName protected String programName;
    @Inject @StdOut protected PrintStream out;
    @Inject @StdErr protected PrintStream err;

    @Parameter()
    protected List<String> args = new ArrayList<>();

    @Parameter(names = {"-c", "--config"})
    protected String configPath = null;

    @Parameter(names = {"-l", "--log-level"})
    protected String logLevel = "info";

    @DynamicParameter(names = "-X")
    protected Map<String, String> systemProperties = new HashMap<>();

    @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
    protected boolean help;

    public abstract void main() throws Exception;

    public abstract SystemExitException usage(String error);

    protected Properties loadSystemProperties()
        throws IOException
    {
        // Later sources take precedence:
        // 1. CRONLATTICE_CONFIG env var
        // 2. JVM system properties (-D... and -X...)
        // 3. explicit configuration file (--config)
        Properties props = new Properties();

        props.load(new StringReader(env.getOrDefault(CONFIG_ENV, "")));

        props.putAll(System.getProperties());
        props.putAll(systemProperties);

        if (configPath != null) {
            props.putAll(PropertyUtils.loadFile(Paths.get(configPath)));
        }

        return props;
    }
}
