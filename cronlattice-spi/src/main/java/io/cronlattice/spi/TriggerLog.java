package io.cronlattice.spi;

import com.google.common.base.Optional;

/**
 * Append-only log of trigger markers, one log per job.
 */
public interface TriggerLog
{
    Optional<TriggerMarker> getLatest(String jobKey);

    /**
     * Appends a marker if its generation directly follows the latest one
     * (or is 1 when the log is empty).
     *
     * @return false if another writer already appended that generation
     * @throws SubstrateException if the log is not reachable
     */
    boolean append(TriggerMarker marker);

    /**
     * Subscribes to expiry of the latest marker of a job.
     *
     * The listener is called once per generation when the latest marker's
     * fire time is reached. A marker that already expired before the
     * subscription was made is delivered too.
     */
    Subscription subscribe(String jobKey, ExpiryListener listener);

    /**
     * Removes every marker of a job.
     */
    void purge(String jobKey);

    interface Subscription
            extends AutoCloseable
    {
        @Override
        void close();
    }
}
