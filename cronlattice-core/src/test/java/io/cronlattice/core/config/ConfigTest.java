package io.cronlattice.core.config;

import java.time.Duration;
import java.util.Properties;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

public class ConfigTest
{
    private ConfigFactory cf;

    @Before
    public void setUp()
    {
        cf = new ConfigFactory(ObjectMappers.objectMapper());
    }

    @Test
    public void getWithDefaults()
    {
        Config config = cf.create()
            .set("a", 1)
            .set("b", "text")
            .set("d", "x")
            .set("d", null);

        assertThat(config.get("a", int.class), is(1));
        assertThat(config.get("b", String.class), is("text"));
        assertThat(config.get("c", String.class, "none"), is("none"));
        assertThat(config.getOptional("c", String.class), is(Optional.absent()));
        assertThat(config.has("a"), is(true));
        assertThat(config.has("c"), is(false));
        assertThat(config.has("d"), is(false));
        assertThat(config.getKeys(), is(ImmutableList.of("a", "b")));
    }

    @Test
    public void requiredKeyMissing()
    {
        try {
            cf.create().get("database.host", String.class);
            throw new AssertionError("ConfigException expected");
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), is("Parameter 'database.host' is required but not set"));
        }
    }

    @Test
    public void conversionErrorNamesExpectedType()
    {
        Config config = cf.create().set("port", "abc");
        try {
            config.get("port", int.class);
            throw new AssertionError("ConfigException expected");
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString("Expected integer (int) type for key 'port' but got \"abc\" (string)"));
        }
    }

    @Test
    public void stringPropertiesAreConverted()
    {
        Properties props = new Properties();
        props.setProperty("scheduler.enabled", "false");
        props.setProperty("substrate.poll_interval", "250");
        props.setProperty("scheduler.lock_lease", "1m 30s");
        Config config = PropertyUtils.toConfig(cf, props);

        assertThat(config.get("scheduler.enabled", boolean.class), is(false));
        assertThat(config.get("substrate.poll_interval", int.class), is(250));
        assertThat(config.get("scheduler.lock_lease", DurationParam.class).getDuration(), is(Duration.ofSeconds(90)));
    }
}
