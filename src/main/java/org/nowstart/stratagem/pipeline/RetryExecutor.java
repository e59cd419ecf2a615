package org.nowstart.stratagem.pipeline;

import java.time.Duration;
import java.util.function.IntConsumer;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a call under a {@link RetryPolicy}. When attempts run out, or the failure is not retryable, the last exception
 * is rethrown as it was raised.
 */
@Slf4j
public class RetryExecutor {

    private final Sleeper sleeper;

    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public <T> T execute(RetryPolicy policy, Supplier<T> call) {
        return execute(policy, call, attempt -> {
        });
    }

    public <T> T execute(RetryPolicy policy, Supplier<T> call, IntConsumer attemptListener) {
        int attempt = 0;
        while (true) {
            attempt++;
            attemptListener.accept(attempt);
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (!policy.retryable().test(e)) {
                    throw e;
                }
                if (attempt >= policy.maxAttempts()) {
                    log.warn("event=retry_exhausted attempts={} reason={}", attempt, e.getMessage());
                    throw e;
                }

                Duration delay = policy.delayFor(attempt);
                log.warn("event=retry_scheduled attempt={} max_attempts={} delay_ms={} reason={}",
                        attempt, policy.maxAttempts(), delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(interrupted);
                    throw e;
                }
            }
        }
    }
}
