package io.cronlattice.core.util;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Runs an operation asynchronously and retries it with capped exponential
 * back-off.
 *
 * Each attempt runs on the given executor and may be bounded by a timeout.
 * Waits between attempts are scheduled on a ScheduledExecutorService so no
 * thread sleeps. When retries are exhausted, or the failure is not
 * retryable, the returned future fails with {@link RetryGiveupException}
 * whose cause is the first failure.
 */
public class RetryExecutor
{
    public static RetryExecutor retryExecutor()
    {
        return new RetryExecutor();
    }

    public static class RetryGiveupException
            extends ExecutionException
    {
        public RetryGiveupException(String message, Exception cause)
        {
            super(message, cause);
        }

        public RetryGiveupException(Exception cause)
        {
            super(cause);
        }

        @Override
        public Exception getCause()
        {
            return (Exception) super.getCause();
        }
    }

    public interface RetryPredicate
            extends Predicate<Exception>
    { }

    public interface RetryAction
    {
        void onRetry(Exception exception, int retryCount, int retryLimit, int retryWait)
            throws RetryGiveupException;
    }

    public interface GiveupAction
    {
        void onGiveup(Exception firstException, Exception lastException)
            throws RetryGiveupException;
    }

    private final int retryLimit;
    private final int initialRetryWait;
    private final int maxRetryWait;
    private final double waitGrowRate;
    private final Duration callTimeout;
    private final ScheduledExecutorService timer;
    private final RetryPredicate retryPredicate;
    private final RetryAction retryAction;
    private final GiveupAction giveupAction;

    private RetryExecutor()
    {
        this(3, 200, 5 * 1000, 2.0, null, null, null, null, null);
    }

    private RetryExecutor(int retryLimit, int initialRetryWait, int maxRetryWait, double waitGrowRate,
            Duration callTimeout, ScheduledExecutorService timer,
            RetryPredicate retryPredicate, RetryAction retryAction, GiveupAction giveupAction)
    {
        this.retryLimit = retryLimit;
        this.initialRetryWait = initialRetryWait;
        this.maxRetryWait = maxRetryWait;
        this.waitGrowRate = waitGrowRate;
        this.callTimeout = callTimeout;
        this.timer = timer;
        this.retryPredicate = retryPredicate;
        this.retryAction = retryAction;
        this.giveupAction = giveupAction;
    }

    public RetryExecutor withRetryLimit(int count)
    {
        return new RetryExecutor(
                count, initialRetryWait, maxRetryWait, waitGrowRate,
                callTimeout, timer, retryPredicate, retryAction, giveupAction);
    }

    public RetryExecutor withInitialRetryWait(int msec)
    {
        return new RetryExecutor(
                retryLimit, msec, maxRetryWait, waitGrowRate,
                callTimeout, timer, retryPredicate, retryAction, giveupAction);
    }

    public RetryExecutor withMaxRetryWait(int msec)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, msec, waitGrowRate,
                callTimeout, timer, retryPredicate, retryAction, giveupAction);
    }

    public RetryExecutor withWaitGrowRate(double rate)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, rate,
                callTimeout, timer, retryPredicate, retryAction, giveupAction);
    }

    public RetryExecutor withCallTimeout(Duration timeout)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                timeout, timer, retryPredicate, retryAction, giveupAction);
    }

    /**
     * Sets the executor that schedules waits between attempts. Without it,
     * retries start immediately.
     */
    public RetryExecutor withTimer(ScheduledExecutorService timer)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                callTimeout, timer, retryPredicate, retryAction, giveupAction);
    }

    public RetryExecutor retryIf(RetryPredicate function)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                callTimeout, timer, function, retryAction, giveupAction);
    }

    public RetryExecutor onRetry(RetryAction function)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                callTimeout, timer, retryPredicate, function, giveupAction);
    }

    public RetryExecutor onGiveup(GiveupAction function)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                callTimeout, timer, retryPredicate, retryAction, function);
    }

    public CompletableFuture<Void> runAsync(Runnable op, Executor executor)
    {
        return runAsync(() -> {
            op.run();
            return (Void) null;
        }, executor);
    }

    public <T> CompletableFuture<T> runAsync(Callable<T> op, Executor executor)
    {
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(op, executor, result, 0, null);
        return result;
    }

    private <T> void attempt(Callable<T> op, Executor executor, CompletableFuture<T> result,
            int retryCount, Exception firstException)
    {
        if (result.isDone()) {
            // cancelled by the caller
            return;
        }
        callOnce(op, executor).whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = unwrap(error);
            if (!(cause instanceof Exception)) {
                result.completeExceptionally(cause);
                return;
            }
            Exception exception = (Exception) cause;
            Exception first = firstException == null ? exception : firstException;

            if (retryCount >= retryLimit || retryPredicate == null || !retryPredicate.test(exception)) {
                try {
                    if (giveupAction != null) {
                        giveupAction.onGiveup(first, exception);
                    }
                    result.completeExceptionally(new RetryGiveupException(first));
                }
                catch (RetryGiveupException ex) {
                    result.completeExceptionally(ex);
                }
                return;
            }

            // exponential back-off with hard limit
            int retryWait = (int) Math.min((double) maxRetryWait, initialRetryWait * Math.pow(waitGrowRate, retryCount));

            int nextRetryCount = retryCount + 1;
            if (retryAction != null) {
                try {
                    retryAction.onRetry(exception, nextRetryCount, retryLimit, retryWait);
                }
                catch (RetryGiveupException ex) {
                    result.completeExceptionally(ex);
                    return;
                }
            }

            if (timer == null || retryWait <= 0) {
                attempt(op, executor, result, nextRetryCount, first);
            }
            else {
                try {
                    timer.schedule(() -> attempt(op, executor, result, nextRetryCount, first), retryWait, TimeUnit.MILLISECONDS);
                }
                catch (RejectedExecutionException ex) {
                    result.completeExceptionally(new RetryGiveupException("Retry timer is shut down", first));
                }
            }
        });
    }

    private <T> CompletableFuture<T> callOnce(Callable<T> op, Executor executor)
    {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    future.complete(op.call());
                }
                catch (Exception ex) {
                    future.completeExceptionally(ex);
                }
            });
        }
        catch (RejectedExecutionException ex) {
            future.completeExceptionally(ex);
        }
        if (callTimeout != null && !future.isDone()) {
            future.orTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return future;
    }

    private static Throwable unwrap(Throwable error)
    {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
