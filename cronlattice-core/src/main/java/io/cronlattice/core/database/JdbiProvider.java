package io.cronlattice.core.database;

import javax.sql.DataSource;
import com.google.inject.Inject;
import com.google.inject.Provider;
import org.jdbi.v3.core.Jdbi;

public class JdbiProvider
        implements Provider<Jdbi>
{
    private final DataSource ds;
    private final AutoMigrator migrator;

    // depends on AutoMigrator so that the schema exists before any store runs a statement
    @Inject
    public JdbiProvider(DataSource ds, AutoMigrator migrator)
    {
        this.ds = ds;
        this.migrator = migrator;
    }

    @Override
    public Jdbi get()
    {
        migrator.migrate();
        return Jdbi.create(ds);
    }
}
