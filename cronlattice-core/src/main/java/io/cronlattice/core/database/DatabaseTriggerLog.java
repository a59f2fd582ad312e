package io.cronlattice.core.database;

import java.time.Clock;
import java.time.Instant;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.cronlattice.core.substrate.PollingTriggerLog;
import io.cronlattice.core.substrate.SubstrateConfig;
import io.cronlattice.spi.TriggerMarker;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

/**
 * Trigger log on the {@code trigger_markers} table.
 *
 * The primary key (job_key, generation) makes concurrent appends of the
 * same generation fail for all writers but one.
 */
public class DatabaseTriggerLog
        extends PollingTriggerLog
{
    private final Store store;

    @Inject
    public DatabaseTriggerLog(Jdbi dbi, Clock clock, SubstrateConfig config)
    {
        super(clock, config.getPollInterval());
        this.store = new Store(dbi);
    }

    @Override
    public Optional<TriggerMarker> getLatest(String jobKey)
    {
        return store.autoCommit(handle -> latest(handle, jobKey));
    }

    @Override
    public boolean append(TriggerMarker marker)
    {
        boolean appended = store.insertUnlessConflict(handle -> {
            long latest = latest(handle, marker.getJobKey())
                .transform(TriggerMarker::getGeneration)
                .or(0L);
            if (marker.getGeneration() != latest + 1) {
                return 0;
            }
            return handle.createUpdate(
                    "insert into trigger_markers (job_key, generation, fire_at, created_at)" +
                    " values (:jobKey, :generation, :fireAt, :createdAt)")
                .bind("jobKey", marker.getJobKey())
                .bind("generation", marker.getGeneration())
                .bind("fireAt", marker.getFireAt().toEpochMilli())
                .bind("createdAt", marker.getCreatedAt().toEpochMilli())
                .execute();
        });
        if (appended) {
            // only the latest two generations are ever read
            store.autoCommit(handle -> handle.createUpdate(
                        "delete from trigger_markers where job_key = :jobKey and generation < :generation")
                    .bind("jobKey", marker.getJobKey())
                    .bind("generation", marker.getGeneration() - 1)
                    .execute());
        }
        return appended;
    }

    @Override
    public void purge(String jobKey)
    {
        store.autoCommit(handle -> handle.createUpdate("delete from trigger_markers where job_key = :jobKey")
                .bind("jobKey", jobKey)
                .execute());
    }

    private static Optional<TriggerMarker> latest(Handle handle, String jobKey)
    {
        return Optional.fromJavaUtil(handle.createQuery(
                    "select job_key, generation, fire_at, created_at from trigger_markers" +
                    " where job_key = :jobKey" +
                    " order by generation desc limit 1")
                .bind("jobKey", jobKey)
                .map((rs, ctx) -> TriggerMarker.of(
                            rs.getString("job_key"),
                            rs.getLong("generation"),
                            Instant.ofEpochMilli(rs.getLong("fire_at")),
                            Instant.ofEpochMilli(rs.getLong("created_at"))))
                .findFirst());
    }

    private static class Store
            extends BasicDatabaseStore
    {
        Store(Jdbi dbi)
        {
            super(dbi);
        }
    }
}
