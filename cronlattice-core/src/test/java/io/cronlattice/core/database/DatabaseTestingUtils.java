package io.cronlattice.core.database;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.Properties;
import java.util.UUID;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.cronlattice.core.config.Config;
import io.cronlattice.core.config.ConfigFactory;
import io.cronlattice.core.config.ObjectMappers;

public class DatabaseTestingUtils
{
    private DatabaseTestingUtils() { }

    /**
     * Returns an in-memory H2 database unless CRONLATTICE_TEST_POSTGRESQL
     * holds connection properties of a PostgreSQL database, e.g.
     * {@code host=localhost user=test database=cronlattice_test}.
     */
    public static DatabaseConfig getEnvironmentDatabaseConfig()
    {
        String pg = System.getenv("CRONLATTICE_TEST_POSTGRESQL");
        if (pg != null && !pg.isEmpty()) {
            Properties props = new Properties();
            try (StringReader reader = new StringReader(pg.replace(' ', '\n'))) {
                props.load(reader);
            }
            catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }

            Config config = new ConfigFactory(ObjectMappers.objectMapper()).create();
            for (String key : props.stringPropertyNames()) {
                config.set("database." + key, props.getProperty(key));
            }
            config.set("database.type", "postgresql");

            return DatabaseConfig.convertFrom(config);
        }
        else {
            return DatabaseConfig.builder()
                .type("h2")
                .path(Optional.absent())
                .options(ImmutableMap.of())
                .autoMigrate(true)
                .connectionTimeout(30)
                .idleTimeout(600)
                .validationTimeout(5)
                .minimumPoolSize(0)
                .maximumPoolSize(10)
                .build();
        }
    }

    /**
     * Job keys are unique per call so that tests sharing a PostgreSQL
     * database don't see each other's rows.
     */
    public static String uniqueKey(String prefix)
    {
        return prefix + "." + UUID.randomUUID().toString().replace("-", "");
    }
}
