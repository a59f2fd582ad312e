package io.cronlattice.core.database;

import java.util.Properties;
import io.cronlattice.core.config.Config;
import io.cronlattice.core.config.ConfigFactory;
import io.cronlattice.core.config.ObjectMappers;
import io.cronlattice.core.config.PropertyUtils;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class PostgresqlConfigTest
{
    private static DatabaseConfig convert(Properties props)
    {
        Config config = PropertyUtils.toConfig(new ConfigFactory(ObjectMappers.objectMapper()), props);
        return DatabaseConfig.convertFrom(config);
    }

    private static Properties postgresql()
    {
        Properties props = new Properties();
        props.setProperty("database.type", "postgresql");
        props.setProperty("database.host", "db.example.com");
        props.setProperty("database.database", "cron");
        props.setProperty("database.user", "scheduler");
        return props;
    }

    @Test
    public void plainConnection()
    {
        DatabaseConfig config = convert(postgresql());

        assertThat(DatabaseConfig.buildJdbcUrl(config), is("jdbc:postgresql://db.example.com/cron"));
        Properties jdbc = DatabaseConfig.buildJdbcProperties(config);
        assertThat(jdbc.getProperty("user"), is("scheduler"));
        assertThat(jdbc.getProperty("password"), is(""));
        assertThat(jdbc.getProperty("loginTimeout"), is("30"));
        assertThat(jdbc.getProperty("ssl"), is(nullValue()));
    }

    @Test
    public void portSslAndOptions()
    {
        Properties props = postgresql();
        props.setProperty("database.port", "6543");
        props.setProperty("database.ssl", "true");
        props.setProperty("database.sslmode", "require");
        props.setProperty("database.opts.ApplicationName", "cronlattice");
        DatabaseConfig config = convert(props);

        assertThat(DatabaseConfig.buildJdbcUrl(config), is("jdbc:postgresql://db.example.com:6543/cron"));
        Properties jdbc = DatabaseConfig.buildJdbcProperties(config);
        assertThat(jdbc.getProperty("ssl"), is("true"));
        assertThat(jdbc.getProperty("sslfactory"), is(PostgresqlConfig.DEFAULT_SSL_FACTORY));
        assertThat(jdbc.getProperty("sslmode"), is("require"));
        assertThat(jdbc.getProperty("ApplicationName"), is("cronlattice"));
    }
}
