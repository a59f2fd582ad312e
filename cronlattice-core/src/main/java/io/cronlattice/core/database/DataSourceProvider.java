package io.cronlattice.core.database;

import java.sql.SQLException;
import javax.sql.DataSource;
import com.google.inject.Inject;
import com.google.inject.Provider;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.cronlattice.core.BackgroundService;
import io.cronlattice.spi.SubstrateException;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DataSourceProvider
        implements Provider<DataSource>, BackgroundService, AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(DataSourceProvider.class);

    private final DatabaseConfig config;
    private DataSource ds;
    private AutoCloseable closer;

    @Inject
    public DataSourceProvider(DatabaseConfig config)
    {
        this.config = config;
    }

    @Override
    public synchronized DataSource get()
    {
        if (ds == null) {
            switch (config.getType()) {
            case "h2":
                // h2 database doesn't need connection pool
                createSimpleDataSource();
                break;
            default:
                createPooledDataSource();
                break;
            }
        }
        return ds;
    }

    private void createSimpleDataSource()
    {
        String url = DatabaseConfig.buildJdbcUrl(config);

        // An in-memory H2 database is dropped when its last connection closes.
        // One connection is held until close() so that the data lives as long
        // as this provider.
        JdbcDataSource ds = new JdbcDataSource();
        ds.setUrl(url + ";DB_CLOSE_ON_EXIT=FALSE");

        logger.debug("Using database URL {}", url);

        try {
            this.closer = ds.getConnection();
        }
        catch (SQLException ex) {
            throw new SubstrateException("Failed to open database " + url, ex);
        }
        this.ds = ds;
    }

    private void createPooledDataSource()
    {
        String url = DatabaseConfig.buildJdbcUrl(config);

        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(url);
        hikari.setDriverClassName(DatabaseMigrator.getDriverClassName(config.getType()));
        hikari.setDataSourceProperties(DatabaseConfig.buildJdbcProperties(config));

        hikari.setConnectionTimeout(config.getConnectionTimeout() * 1000L);
        hikari.setIdleTimeout(config.getIdleTimeout() * 1000L);
        hikari.setValidationTimeout(config.getValidationTimeout() * 1000L);
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setMinimumIdle(config.getMinimumPoolSize());

        logger.debug("Using database URL {}", hikari.getJdbcUrl());

        HikariDataSource ds = new HikariDataSource(hikari);
        this.ds = ds;
        this.closer = ds;
    }

    @Override
    public void start()
    { }

    @Override
    public void shutdown()
    {
        close();
    }

    @Override
    public synchronized void close()
    {
        if (ds != null) {
            try {
                closer.close();
            }
            catch (Exception ex) {
                throw new SubstrateException("Failed to close database connections", ex);
            }
            finally {
                ds = null;
                closer = null;
            }
        }
    }
}
