package io.cronlattice.core.database;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.cronlattice.core.config.Config;
import io.cronlattice.core.config.ConfigException;
import org.immutables.value.Value;

@Value.Immutable
public interface DatabaseConfig
{
    String getType();

    Optional<String> getPath();

    Map<String, String> getOptions();

    Optional<PostgresqlConfig> getPostgresql();

    boolean getAutoMigrate();

    ////
    // HikariCP config params
    //

    int getConnectionTimeout();  // seconds

    int getIdleTimeout();  // seconds

    int getMaximumPoolSize();

    int getMinimumPoolSize();

    int getValidationTimeout();  // seconds

    static ImmutableDatabaseConfig.Builder builder()
    {
        return ImmutableDatabaseConfig.builder();
    }

    static DatabaseConfig convertFrom(Config config)
    {
        ImmutableDatabaseConfig.Builder builder = builder();

        // database.type, path, host, user, password, port, database
        String type = config.get("database.type", String.class, "memory");
        switch (type) {
        case "h2":
            builder.type("h2");
            builder.path(Optional.of(config.get("database.path", String.class)));
            break;
        case "memory":
            builder.type("h2");
            builder.path(Optional.absent());
            break;
        case "postgresql":
            builder.type("postgresql");
            builder.postgresql(PostgresqlConfig.convertFrom(config));
            break;
        default:
            throw new ConfigException("Unknown database.type: " + type);
        }

        builder.connectionTimeout(
                config.get("database.connectionTimeout", int.class, 30));  // HikariCP default: 30
        builder.idleTimeout(
                config.get("database.idleTimeout", int.class, 600));  // HikariCP default: 600
        builder.validationTimeout(
                config.get("database.validationTimeout", int.class, 5));  // HikariCP default: 5

        // one connection per substrate thread is enough
        int maximumPoolSize = config.get("database.maximumPoolSize", int.class, 10);
        builder.maximumPoolSize(maximumPoolSize);
        builder.minimumPoolSize(
                config.get("database.minimumPoolSize", int.class, maximumPoolSize));

        // database.opts.* to options
        ImmutableMap.Builder<String, String> options = ImmutableMap.builder();
        String optionKey = "database.opts.";
        for (String key : config.getKeys()) {
            if (key.startsWith(optionKey)) {
                options.put(key.substring(optionKey.length()), config.get(key, String.class));
            }
        }
        builder.options(options.build());

        builder.autoMigrate(
                config.get("database.migrate", boolean.class, true));

        return builder.build();
    }

    static String buildJdbcUrl(DatabaseConfig config)
    {
        switch (config.getType()) {
        case "h2":
            if (config.getPath().isPresent()) {
                Path dir = FileSystems.getDefault().getPath(config.getPath().get());
                try {
                    Files.createDirectories(dir);
                }
                catch (IOException ex) {
                    throw new ConfigException(ex);
                }
                return String.format(Locale.ENGLISH,
                        "jdbc:h2:%s",
                        dir.resolve("cronlattice").toAbsolutePath().toString());  // h2 requires absolute path
            }
            else {
                return String.format(Locale.ENGLISH,
                        "jdbc:h2:mem:cronlattice-%s",
                        UUID.randomUUID());
            }

        case "postgresql":
            if (!config.getPostgresql().isPresent()) {
                throw new IllegalArgumentException("Database type is postgresql but its connection settings are not set");
            }
            return config.getPostgresql().get().getJdbcUrl();

        default:
            throw new ConfigException("Unsupported database type: " + config.getType());
        }
    }

    static Properties buildJdbcProperties(DatabaseConfig config)
    {
        Properties props = new Properties();
        if (config.getPostgresql().isPresent()) {
            props.putAll(config.getPostgresql().get().getConnectionProperties());
        }
        for (Map.Entry<String, String> pair : config.getOptions().entrySet()) {
            props.setProperty(pair.getKey(), pair.getValue());
        }
        return props;
    }
}
