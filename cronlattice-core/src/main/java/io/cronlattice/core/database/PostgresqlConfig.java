package io.cronlattice.core.database;

import java.util.Locale;
import java.util.Properties;
import com.google.common.base.Optional;
import io.cronlattice.core.config.Config;
import org.immutables.value.Value;

/**
 * Connection settings of a PostgreSQL substrate, read from the
 * {@code database.*} system properties.
 */
@Value.Immutable
public interface PostgresqlConfig
{
    String DEFAULT_SSL_FACTORY = "org.postgresql.ssl.NonValidatingFactory";

    String getHost();

    Optional<Integer> getPort();

    String getDatabase();

    String getUser();

    String getPassword();

    int getLoginTimeout();  // seconds

    int getSocketTimeout();  // seconds

    // present when SSL is enabled
    Optional<String> getSslFactory();

    Optional<String> getSslMode();

    static PostgresqlConfig convertFrom(Config config)
    {
        ImmutablePostgresqlConfig.Builder builder = ImmutablePostgresqlConfig.builder()
            .host(config.get("database.host", String.class))
            .port(config.getOptional("database.port", Integer.class))
            .database(config.get("database.database", String.class))
            .user(config.get("database.user", String.class))
            .password(config.get("database.password", String.class, ""))
            .loginTimeout(config.get("database.loginTimeout", int.class, 30))
            .socketTimeout(config.get("database.socketTimeout", int.class, 1800));
        if (config.get("database.ssl", boolean.class, false)) {
            builder.sslFactory(config.get("database.sslfactory", String.class, DEFAULT_SSL_FACTORY));
            builder.sslMode(config.getOptional("database.sslmode", String.class));
        }
        return builder.build();
    }

    default String getJdbcUrl()
    {
        if (getPort().isPresent()) {
            return String.format(Locale.ENGLISH, "jdbc:postgresql://%s:%d/%s", getHost(), getPort().get(), getDatabase());
        }
        return String.format(Locale.ENGLISH, "jdbc:postgresql://%s/%s", getHost(), getDatabase());
    }

    default Properties getConnectionProperties()
    {
        Properties props = new Properties();
        props.setProperty("user", getUser());
        props.setProperty("password", getPassword());
        props.setProperty("loginTimeout", Integer.toString(getLoginTimeout()));
        props.setProperty("socketTimeout", Integer.toString(getSocketTimeout()));
        props.setProperty("tcpKeepAlive", "true");
        if (getSslFactory().isPresent()) {
            props.setProperty("ssl", "true");
            props.setProperty("sslfactory", getSslFactory().get());
            if (getSslMode().isPresent()) {
                props.setProperty("sslmode", getSslMode().get());
            }
        }
        return props;
    }
}
