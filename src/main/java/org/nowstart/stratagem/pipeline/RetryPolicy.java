package org.nowstart.stratagem.pipeline;

import java.time.Duration;
import java.util.function.Predicate;
import org.nowstart.stratagem.data.exception.TransientIOException;

/**
 * Bounded exponential backoff: the wait after attempt {@code k} is {@code min(baseDelay * 2^(k-1), maxDelay)}.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, Predicate<Throwable> retryable) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay == null || baseDelay.isNegative() || maxDelay == null || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must be non-negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(4), TransientIOException.class::isInstance);
    }

    public Duration delayFor(int attempt) {
        int exponent = Math.max(0, attempt - 1);
        if (exponent >= 31) {
            return maxDelay;
        }
        Duration delay = baseDelay.multipliedBy(1L << exponent);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
