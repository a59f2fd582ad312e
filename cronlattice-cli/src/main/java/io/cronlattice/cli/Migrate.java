package io.cronlattice.cli;

import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;
import com.beust.jcommander.Parameter;
import io.cronlattice.core.config.Config;
import io.cronlattice.core.config.ConfigFactory;
import io.cronlattice.core.config.ObjectMappers;
import io.cronlattice.core.config.PropertyUtils;
import io.cronlattice.core.database.DataSourceProvider;
import io.cronlattice.core.database.DatabaseConfig;
import io.cronlattice.core.database.DatabaseMigrator;
import io.cronlattice.core.database.migrate.Migration;
import org.jdbi.v3.core.Jdbi;

import static io.cronlattice.cli.SystemExitException.systemExit;

public class Migrate
    extends Command
{
    @Parameter(names = {"-o", "--database"})
    String database = null;

    SubCommand subCommand = null;

    @Override
    public void main()
            throws Exception
    {
        checkArgs();
        DatabaseConfig dbConfig = DatabaseConfig.convertFrom(buildConfig());
        try (DataSourceProvider dsp = new DataSourceProvider(dbConfig)) {
            Jdbi dbi = Jdbi.create(dsp.get());
            DatabaseMigrator migrator = new DatabaseMigrator(dbi, dbConfig);
            switch (subCommand) {
                case RUN:
                    runMigrate(migrator);
                    break;
                case CHECK:
                    checkMigrate(migrator);
                    break;
                default:
                    throw new IllegalStateException("No command");
            }
        }
    }

    // migrate run
    private void runMigrate(DatabaseMigrator migrator)
    {
        int numApplied = migrator.migrate();
        if (numApplied == 0) {
            out.println("No update");
        }
        else {
            out.println("Migrations successfully finished");
        }
    }

    // migrate check
    private void checkMigrate(DatabaseMigrator migrator)
    {
        if (!migrator.existsSchemaMigrationsTable()) {
            out.println("No table exist");
            return;
        }

        List<Migration> migrations = migrator.getApplicableMigrations();
        for (Migration m : migrations) {
            out.println(m.getVersion());
        }
        if (migrations.isEmpty()) {
            out.println("No update");
        }
    }

    private void checkArgs()
        throws SystemExitException
    {
        if (args.size() != 1) {
            throw usage("Invalid parameters");
        }
        switch (args.get(0)) {
            case "run":
                subCommand = SubCommand.RUN;
                break;
            case "check":
                subCommand = SubCommand.CHECK;
                break;
            default:
                throw usage("Invalid command");
        }

        if (database == null && configPath == null) {
            throw usage("--database, or --config option is required");
        }
    }

    private Config buildConfig()
            throws Exception
    {
        Properties props = loadSystemProperties();
        if (database != null) {
            props.setProperty("database.type", "h2");
            props.setProperty("database.path", Paths.get(database).toAbsolutePath().toString());
        }
        return PropertyUtils.toConfig(new ConfigFactory(ObjectMappers.objectMapper()), props);
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " migrate (run|check) run or check database migration");
        err.println("  Options:");
        err.println("    -c, --config PATH.properties     configuration file");
        err.println("    -o, --database DIR               path to H2 database");
        return systemExit(error);
    }

    private enum SubCommand
    {
        RUN,
        CHECK,
    }
}
