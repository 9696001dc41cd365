package com.tradingagent.resilience;

import com.tradingagent.exception.CollaboratorUnavailableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs every call to an external collaborator on the collaborator executor, bounded by a
 * Resilience4j {@link TimeLimiter} and retried by a {@link Retry} built from the call's
 * {@link CallPolicy}.
 *
 * <p>Whatever goes wrong (timeout, venue error, provider bug) the caller sees one exception
 * type, {@link CollaboratorUnavailableException}, once the policy is exhausted. Timeouts are
 * flagged so order submission can keep following the attempt it started.
 */
@Component
public class ExternalCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(ExternalCallExecutor.class);

    private final Executor collaboratorExecutor;

    public ExternalCallExecutor(@Qualifier("collaboratorExecutor") Executor collaboratorExecutor) {
        this.collaboratorExecutor = collaboratorExecutor;
    }

    public <T> T call(CallPolicy policy, Supplier<T> call) {
        TimeLimiter timeLimiter = TimeLimiter.of(policy.getName(), policy.toTimeLimiterConfig());
        Retry retry = Retry.of(policy.getName(), policy.toRetryConfig());
        retry.getEventPublisher()
                .onRetry(event -> log.warn(
                        "Retrying {} (attempt {}): {}",
                        policy.getName(),
                        event.getNumberOfRetryAttempts() + 1,
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        Callable<T> bounded = TimeLimiter.decorateFutureSupplier(
                timeLimiter, () -> CompletableFuture.supplyAsync(call, collaboratorExecutor));
        Callable<T> retried = Retry.decorateCallable(retry, bounded);

        try {
            return retried.call();
        } catch (Exception e) {
            throw unavailable(policy, e);
        }
    }

    /**
     * Starts a single attempt on the collaborator executor without waiting for it. Used with
     * {@link #await} when a timed-out attempt must be followed to completion rather than
     * abandoned. A saturated executor yields an already-failed attempt.
     */
    public <T> CompletableFuture<T> start(Supplier<T> call) {
        try {
            return CompletableFuture.supplyAsync(call, collaboratorExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Waits at most the policy timeout for an attempt started with {@link #start}. A timeout
     * leaves the attempt running, so it can be awaited again under a longer policy.
     */
    public <T> T await(CallPolicy policy, CompletableFuture<T> attempt) {
        TimeLimiter timeLimiter = TimeLimiter.of(policy.getName(), policy.toTimeLimiterConfig(false));
        try {
            return timeLimiter.executeFutureSupplier(() -> attempt);
        } catch (Exception e) {
            throw unavailable(policy, e);
        }
    }

    public void run(CallPolicy policy, Runnable call) {
        call(policy, () -> {
            call.run();
            return null;
        });
    }

    private static CollaboratorUnavailableException unavailable(CallPolicy policy, Exception e) {
        if (e instanceof TimeoutException) {
            log.warn("{} timed out after {}", policy.getName(), policy.getTimeout());
            return new CollaboratorUnavailableException(policy.getName(), true, e);
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new CollaboratorUnavailableException(policy.getName(), false, e);
        }
        log.warn("{} failed: {}", policy.getName(), e.getMessage());
        return new CollaboratorUnavailableException(policy.getName(), false, e);
    }
}
