package io.cronlattice.core.database;

import java.time.Duration;
import java.time.Instant;
import com.google.common.base.Optional;
import io.cronlattice.core.ManualClock;
import io.cronlattice.spi.KeyValueEntry;
import org.jdbi.v3.core.Jdbi;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class DatabaseKeyValueStoreTest
{
    private static final Instant START = Instant.parse("2024-01-15T10:00:00Z");

    private final ManualClock clock = new ManualClock(START);
    private DataSourceProvider dsp;
    private DatabaseKeyValueStore kv;
    private String key;

    @Before
    public void setUp()
    {
        DatabaseConfig config = DatabaseTestingUtils.getEnvironmentDatabaseConfig();
        dsp = new DataSourceProvider(config);
        Jdbi dbi = new JdbiProvider(dsp.get(), new AutoMigrator(dsp.get(), config)).get();
        kv = new DatabaseKeyValueStore(dbi, clock);
        key = DatabaseTestingUtils.uniqueKey("lock");
    }

    @After
    public void tearDown()
    {
        dsp.close();
    }

    @Test
    public void createIfAbsent()
    {
        assertThat(kv.create(key, "a", Optional.absent()), is(true));
        assertThat(kv.create(key, "b", Optional.absent()), is(false));

        KeyValueEntry entry = kv.get(key).get();
        assertThat(entry.getKey(), is(key));
        assertThat(entry.getValue(), is("a"));
        assertThat(entry.getExpiresAt(), is(Optional.absent()));
    }

    @Test
    public void expiredEntryCanBeCreatedAgain()
    {
        assertThat(kv.create(key, "a", Optional.of(Duration.ofSeconds(5))), is(true));
        assertThat(kv.get(key).get().getExpiresAt(), is(Optional.of(START.plusSeconds(5))));

        clock.advance(Duration.ofMillis(4999));
        assertThat(kv.create(key, "b", Optional.of(Duration.ofSeconds(5))), is(false));

        clock.advance(Duration.ofMillis(1));
        assertThat(kv.get(key).isPresent(), is(false));
        assertThat(kv.create(key, "b", Optional.of(Duration.ofSeconds(5))), is(true));
        assertThat(kv.get(key).get().getValue(), is("b"));
    }

    @Test
    public void compareAndSet()
    {
        kv.create(key, "1", Optional.absent());
        assertThat(kv.compareAndSet(key, "0", "2"), is(false));
        assertThat(kv.compareAndSet(key, "1", "2"), is(true));
        assertThat(kv.get(key).get().getValue(), is("2"));
        assertThat(kv.compareAndSet(DatabaseTestingUtils.uniqueKey("missing"), "2", "3"), is(false));
    }

    @Test
    public void expiredEntryIsNotUpdated()
    {
        kv.create(key, "1", Optional.of(Duration.ofSeconds(1)));
        clock.advance(Duration.ofSeconds(1));
        assertThat(kv.compareAndSet(key, "1", "2"), is(false));
        assertThat(kv.compareAndDelete(key, "1"), is(false));
    }

    @Test
    public void compareAndDelete()
    {
        kv.create(key, "1", Optional.absent());
        assertThat(kv.compareAndDelete(key, "0"), is(false));
        assertThat(kv.compareAndDelete(key, "1"), is(true));
        assertThat(kv.get(key).isPresent(), is(false));
    }

    @Test
    public void deleteIgnoresMissingKeys()
    {
        kv.delete(key);
        kv.create(key, "1", Optional.absent());
        kv.delete(key);
        assertThat(kv.get(key).isPresent(), is(false));
    }
}
