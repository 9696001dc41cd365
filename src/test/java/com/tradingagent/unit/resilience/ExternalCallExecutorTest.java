package com.tradingagent.unit.resilience;

import static com.tradingagent.support.TestFixtures.policy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.tradingagent.exception.CollaboratorUnavailableException;
import com.tradingagent.exception.VenueException;
import com.tradingagent.resilience.CallPolicy;
import com.tradingagent.resilience.ExternalCallExecutor;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExternalCallExecutorTest {

    private ExecutorService executorService;
    private ExternalCallExecutor executor;

    @BeforeEach
    void setUp() {
        executorService = Executors.newCachedThreadPool();
        executor = new ExternalCallExecutor(executorService);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    @DisplayName("Returns the collaborator's value")
    void returnsValue() {
        assertThat(executor.call(policy("quote", 500, 1), () -> 42)).isEqualTo(42);
    }

    @Test
    @DisplayName("maxAttempts of 2 means exactly one retry")
    void retriesUpToMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        CallPolicy twice = policy("positions", 500, 1).withMaxAttempts(2);

        assertThatThrownBy(() -> executor.call(twice, () -> {
                    calls.incrementAndGet();
                    throw new VenueException("down");
                }))
                .isInstanceOf(CollaboratorUnavailableException.class)
                .hasMessageContaining("positions")
                .hasRootCauseInstanceOf(VenueException.class);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Succeeds when the retry succeeds")
    void recoversOnRetry() {
        AtomicInteger calls = new AtomicInteger();

        String value = executor.call(policy("positions", 500, 2), () -> {
            if (calls.incrementAndGet() == 1) {
                throw new VenueException("blip");
            }
            return "ok";
        });

        assertThat(value).isEqualTo("ok");
    }

    @Test
    @DisplayName("Flags timeouts")
    void timeoutIsFlagged() {
        CollaboratorUnavailableException ex = assertThrows(
                CollaboratorUnavailableException.class,
                () -> executor.call(policy("slow", 100, 1), () -> {
                    try {
                        Thread.sleep(2_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "late";
                }));

        assertThat(ex.isTimedOut()).isTrue();
        assertThat(ex.getCallName()).isEqualTo("slow");
    }

    @Test
    @DisplayName("Plain failures are not flagged as timeouts")
    void failureIsNotTimeout() {
        CollaboratorUnavailableException ex = assertThrows(
                CollaboratorUnavailableException.class,
                () -> executor.run(policy("cancel", 500, 1), () -> {
                    throw new IllegalStateException("bug");
                }));

        assertThat(ex.isTimedOut()).isFalse();
    }

    @Test
    @DisplayName("A timed-out await leaves the attempt running for a longer await")
    void awaitTimeoutKeepsAttemptAlive() {
        CompletableFuture<String> attempt = executor.start(() -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "filled";
        });

        CollaboratorUnavailableException ex = assertThrows(
                CollaboratorUnavailableException.class, () -> executor.await(policy("venue-order", 100, 1), attempt));

        assertThat(ex.isTimedOut()).isTrue();
        assertThat(attempt.isCancelled()).isFalse();
        assertThat(executor.await(policy("venue-order-settle", 2_000, 1), attempt)).isEqualTo("filled");
    }

    @Test
    @DisplayName("A failed attempt surfaces the collaborator's error")
    void awaitFailureIsNotTimeout() {
        CompletableFuture<String> attempt = executor.start(() -> {
            throw new VenueException("venue down");
        });

        assertThatThrownBy(() -> executor.await(policy("venue-order", 500, 1), attempt))
                .isInstanceOf(CollaboratorUnavailableException.class)
                .hasMessageContaining("venue down")
                .hasRootCauseInstanceOf(VenueException.class);
    }
}
