package com.tradingagent.resilience;

import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Time budget and retry allowance for one kind of external call.
 *
 * <p>{@code maxAttempts} counts the first call: 1 means no retry, 2 means exactly one retry.
 */
@Value
@Builder(toBuilder = true)
public class CallPolicy {

    String name;
    Duration timeout;
    int maxAttempts;
    Duration waitDuration;

    public CallPolicy withMaxAttempts(int attempts) {
        return toBuilder().maxAttempts(attempts).build();
    }

    RetryConfig toRetryConfig() {
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .waitDuration(waitDuration != null ? waitDuration : Duration.ZERO)
                .build();
    }

    TimeLimiterConfig toTimeLimiterConfig() {
        return toTimeLimiterConfig(true);
    }

    TimeLimiterConfig toTimeLimiterConfig(boolean cancelOnTimeout) {
        return TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(cancelOnTimeout)
                .build();
    }
}
