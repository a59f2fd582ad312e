package io.cronlattice.core.database;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import io.cronlattice.core.database.migrate.Migration;
import io.cronlattice.core.database.migrate.MigrationContext;
import io.cronlattice.core.database.migrate.Migration_20240115093000_CreateSchedulerTables;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DatabaseMigrator
{
    private static final Logger logger = LoggerFactory.getLogger(DatabaseMigrator.class);

    private final List<Migration> migrations = Stream.of(new Migration[] {
        new Migration_20240115093000_CreateSchedulerTables(),
    })
    .sorted(Comparator.comparing(m -> m.getVersion()))
    .collect(Collectors.toList());

    private final Jdbi dbi;
    private final String databaseType;

    @Inject
    public DatabaseMigrator(Jdbi dbi, DatabaseConfig config)
    {
        this(dbi, config.getType());
    }

    DatabaseMigrator(Jdbi dbi, String databaseType)
    {
        this.dbi = dbi;
        this.databaseType = databaseType;
    }

    public static String getDriverClassName(String type)
    {
        switch (type) {
        case "h2":
            return "org.h2.Driver";
        case "postgresql":
            return "org.postgresql.Driver";
        default:
            throw new IllegalArgumentException("Unsupported database type: " + type);
        }
    }

    public int migrate()
    {
        int numApplied = 0;
        MigrationContext context = new MigrationContext(databaseType);
        Set<String> appliedSet;
        try (Handle handle = dbi.open()) {
            if (!existsSchemaMigrationsTable(handle)) {
                createSchemaMigrationsTable(handle, context);
            }
            appliedSet = getAppliedMigrationNames(handle);
        }
        for (Migration m : migrations) {
            if (appliedSet.add(m.getVersion())) {
                if (applyMigrationIfNotDone(context, m)) {
                    numApplied++;
                }
            }
        }
        if (numApplied > 0) {
            logger.info("{} migrations applied.", numApplied);
        }
        return numApplied;
    }

    // synchronized so that threads of one process don't run the same migration
    private synchronized boolean applyMigrationIfNotDone(MigrationContext context, Migration m)
    {
        try (Handle handle = dbi.open()) {
            return handle.inTransaction((h) -> {
                if (context.isPostgres()) {
                    // lock the table so that other processes don't run migrations concurrently
                    h.execute("LOCK TABLE schema_migrations IN EXCLUSIVE MODE");
                    if (checkIfMigrationApplied(h, m.getVersion())) {
                        return false;
                    }
                }
                logger.info("Applying database migration: {}", m.getVersion());
                applyMigration(m, h, context);
                return true;
            });
        }
    }

    /**
     * Returns migrations that are not applied yet.
     */
    public List<Migration> getApplicableMigrations()
    {
        List<Migration> applicableMigrations = new ArrayList<>();
        try (Handle handle = dbi.open()) {
            if (!existsSchemaMigrationsTable(handle)) {
                applicableMigrations.addAll(migrations);
                return applicableMigrations;
            }
            Set<String> appliedSet = getAppliedMigrationNames(handle);
            for (Migration m : migrations) {
                if (!appliedSet.contains(m.getVersion())) {
                    applicableMigrations.add(m);
                }
            }
        }
        return applicableMigrations;
    }

    private Set<String> getAppliedMigrationNames(Handle handle)
    {
        return new HashSet<>(
                handle.createQuery("select name from schema_migrations")
                .mapTo(String.class)
                .list());
    }

    private boolean checkIfMigrationApplied(Handle handle, String name)
    {
        return handle.createQuery("select name from schema_migrations where name = :name limit 1")
            .bind("name", name)
            .mapTo(String.class)
            .findFirst()
            .isPresent();
    }

    private void createSchemaMigrationsTable(Handle handle, MigrationContext context)
    {
        handle.execute(
                context.newCreateTableBuilder("schema_migrations")
                .addString("name", "not null")
                .addTimestamp("created_at", "not null")
                .build());
    }

    public boolean existsSchemaMigrationsTable()
    {
        try (Handle handle = dbi.open()) {
            return existsSchemaMigrationsTable(handle);
        }
    }

    private boolean existsSchemaMigrationsTable(Handle handle)
    {
        try {
            handle.createQuery("select name from schema_migrations limit 1")
                    .mapTo(String.class)
                    .list();
            return true;
        }
        catch (RuntimeException re) {
            return false;
        }
    }

    @VisibleForTesting
    void applyMigration(Migration m, Handle handle, MigrationContext context)
    {
        m.migrate(handle, context);
        handle.execute("insert into schema_migrations (name, created_at) values (?, now())", m.getVersion());
    }
}
