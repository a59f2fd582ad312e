package io.cronlattice.core.database;

import javax.sql.DataSource;
import com.google.inject.Inject;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies pending schema migrations before the first store uses the
 * database, unless {@code database.migrate} is false.
 */
public class AutoMigrator
{
    private static final Logger logger = LoggerFactory.getLogger(AutoMigrator.class);

    private DatabaseMigrator migrator;

    @Inject
    public AutoMigrator(DataSource ds, DatabaseConfig config)
    {
        if (config.getAutoMigrate()) {
            this.migrator = new DatabaseMigrator(Jdbi.create(ds), config);
        }
        else {
            logger.debug("Automatic schema migration is disabled");
        }
    }

    public synchronized void migrate()
    {
        if (migrator != null) {
            migrator.migrate();
            migrator = null;
        }
    }
}
