package io.cronlattice.core.substrate;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import com.google.inject.Inject;
import io.cronlattice.core.SchedulerConfig;
import io.cronlattice.core.SchedulerExecutors;
import io.cronlattice.core.util.RetryExecutor;
import io.cronlattice.spi.SubstrateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.cronlattice.core.util.RetryExecutor.retryExecutor;

/**
 * Runs trigger log and key-value store calls on the substrate pool with a
 * per-call timeout and retries.
 *
 * Only {@link SubstrateException} and timeouts are retried. Futures fail
 * with {@link RetryExecutor.RetryGiveupException} once retries run out.
 */
public class SubstrateExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(SubstrateExecutor.class);

    private final Executor executor;
    private final RetryExecutor retryExecutor;

    @Inject
    public SubstrateExecutor(SchedulerExecutors executors, SchedulerConfig config)
    {
        this(executors.getSubstrateExecutor(),
                retryExecutor()
                .withRetryLimit(config.getSubstrateRetryLimit())
                .withInitialRetryWait(config.getSubstrateInitialRetryWaitMillis())
                .withMaxRetryWait(config.getSubstrateMaxRetryWaitMillis())
                .withWaitGrowRate(2.0)
                .withCallTimeout(config.getSubstrateTimeout())
                .withTimer(executors.getTimer()));
    }

    public SubstrateExecutor(Executor executor, RetryExecutor retryExecutor)
    {
        this.executor = executor;
        this.retryExecutor = retryExecutor;
    }

    public <T> CompletableFuture<T> call(String operation, Callable<T> op)
    {
        return retryExecutor
            .retryIf(ex -> ex instanceof SubstrateException || ex instanceof TimeoutException)
            .onRetry((exception, retryCount, retryLimit, retryWait) -> {
                logger.warn("Substrate call failed: {}. Retrying {}/{} after {}ms: {}",
                        operation, retryCount, retryLimit, retryWait, exception.toString());
            })
            .runAsync(op, executor);
    }

    public CompletableFuture<Void> run(String operation, Runnable op)
    {
        return call(operation, () -> {
            op.run();
            return (Void) null;
        });
    }
}
