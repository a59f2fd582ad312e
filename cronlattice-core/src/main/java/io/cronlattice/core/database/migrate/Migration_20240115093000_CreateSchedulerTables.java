package io.cronlattice.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20240115093000_CreateSchedulerTables
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        // fire_at, created_at and expires_at are epoch milliseconds
        handle.execute(
                context.newCreateTableBuilder("trigger_markers")
                        .addString("job_key", "not null")
                        .addLong("generation", "not null")
                        .addLong("fire_at", "not null")
                        .addLong("created_at", "not null")
                        .addPrimaryKey("job_key", "generation")
                        .build());

        handle.execute(
                context.newCreateTableBuilder("kv_entries")
                        .addString("entry_key", "not null primary key")
                        .addText("entry_value", "not null")
                        .addLong("expires_at", "null")
                        .build());

        handle.execute("create index kv_entries_on_expires_at on kv_entries (expires_at)");
    }
}
