package org.nowstart.stratagem.service;

import feign.FeignException;
import feign.RetryableException;
import org.nowstart.stratagem.data.exception.InvalidInputException;
import org.nowstart.stratagem.data.exception.PipelineException;
import org.nowstart.stratagem.data.exception.TransientIOException;

/**
 * Classifies upstream HTTP failures: timeouts, rate limits and server errors are transient, the rest need caller action.
 */
final class FeignErrors {

    private FeignErrors() {
    }

    static PipelineException classify(String upstream, FeignException exception) {
        int status = exception.status();
        String message = upstream + " request failed. status=" + status + " reason=" + exception.getMessage();
        if (exception instanceof RetryableException || isTransientStatus(status)) {
            return new TransientIOException(message, exception);
        }
        return new InvalidInputException(message, exception);
    }

    static boolean isTransientStatus(int status) {
        return status < 0 || status == 408 || status == 429 || status >= 500;
    }
}
