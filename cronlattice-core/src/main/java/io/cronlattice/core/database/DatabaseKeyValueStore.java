package io.cronlattice.core.database;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.cronlattice.spi.KeyValueEntry;
import io.cronlattice.spi.KeyValueStore;
import org.jdbi.v3.core.Jdbi;

/**
 * Key-value store on the {@code kv_entries} table.
 *
 * Expired rows stay in the table until they are overwritten or deleted.
 * Every statement checks {@code expires_at} against the clock so that an
 * expired row behaves as if it did not exist.
 */
public class DatabaseKeyValueStore
        extends BasicDatabaseStore
        implements KeyValueStore
{
    private static final String LIVE = "(expires_at is null or expires_at > :now)";

    private final Clock clock;

    @Inject
    public DatabaseKeyValueStore(Jdbi dbi, Clock clock)
    {
        super(dbi);
        this.clock = clock;
    }

    @Override
    public Optional<KeyValueEntry> get(String key)
    {
        long now = nowMillis();
        return autoCommit(handle -> Optional.fromJavaUtil(handle.createQuery(
                        "select entry_key, entry_value, expires_at from kv_entries" +
                        " where entry_key = :key and " + LIVE)
                    .bind("key", key)
                    .bind("now", now)
                    .map((rs, ctx) -> {
                        long expiresAt = rs.getLong("expires_at");
                        Optional<Instant> expires = rs.wasNull()
                            ? Optional.absent()
                            : Optional.of(Instant.ofEpochMilli(expiresAt));
                        return KeyValueEntry.of(rs.getString("entry_key"), rs.getString("entry_value"), expires);
                    })
                    .findFirst()));
    }

    @Override
    public boolean create(String key, String value, Optional<Duration> ttl)
    {
        long now = nowMillis();
        Long expiresAt = ttl.isPresent() ? now + ttl.get().toMillis() : null;
        return insertUnlessConflict(handle -> {
            handle.createUpdate("delete from kv_entries where entry_key = :key and expires_at <= :now")
                .bind("key", key)
                .bind("now", now)
                .execute();
            return handle.createUpdate(
                    "insert into kv_entries (entry_key, entry_value, expires_at)" +
                    " values (:key, :value, :expiresAt)")
                .bind("key", key)
                .bind("value", value)
                .bind("expiresAt", expiresAt)
                .execute();
        });
    }

    @Override
    public boolean compareAndSet(String key, String expectedValue, String newValue)
    {
        long now = nowMillis();
        return autoCommit(handle -> handle.createUpdate(
                    "update kv_entries set entry_value = :newValue" +
                    " where entry_key = :key and entry_value = :expected and " + LIVE)
                .bind("key", key)
                .bind("expected", expectedValue)
                .bind("newValue", newValue)
                .bind("now", now)
                .execute()) > 0;
    }

    @Override
    public boolean compareAndDelete(String key, String expectedValue)
    {
        long now = nowMillis();
        return autoCommit(handle -> handle.createUpdate(
                    "delete from kv_entries" +
                    " where entry_key = :key and entry_value = :expected and " + LIVE)
                .bind("key", key)
                .bind("expected", expectedValue)
                .bind("now", now)
                .execute()) > 0;
    }

    @Override
    public void delete(String key)
    {
        autoCommit(handle -> handle.createUpdate("delete from kv_entries where entry_key = :key")
                .bind("key", key)
                .execute());
    }

    private long nowMillis()
    {
        return clock.instant().toEpochMilli();
    }
}
