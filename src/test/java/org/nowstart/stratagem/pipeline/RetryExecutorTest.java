package org.nowstart.stratagem.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.nowstart.stratagem.data.exception.InvalidInputException;
import org.nowstart.stratagem.data.exception.TransientIOException;
import org.nowstart.stratagem.data.property.PipelineProperties;

class RetryExecutorTest {

    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final RetryExecutor executor = new RetryExecutor(sleeper);

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    void execute_returnsFirstSuccessWithoutSleeping() {
        String result = executor.execute(RetryPolicy.defaults(), () -> "ok");

        assertThat(result).isEqualTo("ok");
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void execute_retriesTransientFailuresWithExponentialBackoff() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute(RetryPolicy.defaults(), () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientIOException("timeout");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void execute_rethrowsLastTransientFailureWhenAttemptsRunOut() {
        TransientIOException last = new TransientIOException("third");
        List<TransientIOException> failures = List.of(
                new TransientIOException("first"),
                new TransientIOException("second"),
                last
        );
        AtomicInteger calls = new AtomicInteger();
        List<Integer> attempts = new ArrayList<>();

        assertThatThrownBy(() -> executor.execute(RetryPolicy.defaults(), () -> {
            throw failures.get(calls.getAndIncrement());
        }, attempts::add)).isSameAs(last);

        assertThat(attempts).containsExactly(1, 2, 3);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void execute_doesNotRetryNonRetryableFailures() {
        AtomicInteger calls = new AtomicInteger();
        InvalidInputException invalid = new InvalidInputException("Unknown ticker ZZZZ");

        assertThatThrownBy(() -> executor.execute(RetryPolicy.defaults(), () -> {
            calls.incrementAndGet();
            throw invalid;
        })).isSameAs(invalid);

        assertThat(calls).hasValue(1);
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void execute_stopsAndRestoresInterruptFlagWhenSleepIsInterrupted() {
        RetryExecutor interrupted = new RetryExecutor(duration -> {
            throw new InterruptedException("shutdown");
        });
        TransientIOException failure = new TransientIOException("timeout");

        assertThatThrownBy(() -> interrupted.execute(RetryPolicy.defaults(), () -> {
            throw failure;
        })).isSameAs(failure);

        assertThat(failure.getSuppressed()).hasSize(1);
        assertThat(failure.getSuppressed()[0]).isInstanceOf(InterruptedException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void delayFor_capsAtMaxDelay() {
        RetryPolicy policy = new RetryPolicy(6, Duration.ofSeconds(1), Duration.ofSeconds(4), e -> true);

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayFor(5)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayFor(40)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void constructor_rejectsZeroAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, e -> true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pipelineRetryPolicies_dataFetchAlsoRetriesUncheckedIo() {
        PipelineRetryPolicies policies = new PipelineRetryPolicies(PipelineTestFixtures.properties(false));
        UncheckedIOException io = new UncheckedIOException(new IOException("connection reset"));

        assertThat(policies.dataFetch().retryable().test(io)).isTrue();
        assertThat(policies.llmCall().retryable().test(io)).isFalse();
        assertThat(policies.llmCall().maxAttempts()).isEqualTo(3);
        assertThat(policies.llmCall().retryable().test(new InvalidInputException("bad key"))).isFalse();
    }

    @Test
    void pipelineRetryPolicies_followConfiguredAttempts() {
        PipelineProperties properties = new PipelineProperties(
                "gpt-4o-mini",
                "http://llm.local",
                "",
                "http://market.local",
                5,
                2,
                Duration.ofMillis(100),
                Duration.ofMillis(250),
                Duration.ofHours(24),
                Duration.ofMinutes(5),
                false
        );

        PipelineRetryPolicies policies = new PipelineRetryPolicies(properties);

        assertThat(policies.llmCall().maxAttempts()).isEqualTo(5);
        assertThat(policies.dataFetch().maxAttempts()).isEqualTo(2);
        assertThat(policies.dataFetch().delayFor(3)).isEqualTo(Duration.ofMillis(250));
    }
}
