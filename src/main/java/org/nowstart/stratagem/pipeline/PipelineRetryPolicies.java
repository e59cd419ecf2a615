package org.nowstart.stratagem.pipeline;

import java.io.UncheckedIOException;
import org.nowstart.stratagem.data.exception.TransientIOException;
import org.nowstart.stratagem.data.property.PipelineProperties;
import org.springframework.stereotype.Component;

/**
 * Retry policies per call site, built from {@link PipelineProperties}.
 */
@Component
public class PipelineRetryPolicies {

    private final RetryPolicy llmCall;
    private final RetryPolicy dataFetch;

    public PipelineRetryPolicies(PipelineProperties properties) {
        this.llmCall = new RetryPolicy(
                properties.llmMaxAttempts(),
                properties.retryBaseDelay(),
                properties.retryMaxDelay(),
                TransientIOException.class::isInstance
        );
        this.dataFetch = new RetryPolicy(
                properties.dataMaxAttempts(),
                properties.retryBaseDelay(),
                properties.retryMaxDelay(),
                e -> e instanceof TransientIOException || e instanceof UncheckedIOException
        );
    }

    public RetryPolicy llmCall() {
        return llmCall;
    }

    public RetryPolicy dataFetch() {
        return dataFetch;
    }
}
