package org.nowstart.stratagem.data.exception;

import org.springframework.http.HttpStatus;

/**
 * Network, timeout or rate-limit failure. Retryable.
 */
public class TransientIOException extends PipelineException {

    public TransientIOException(String message) {
        super(HttpStatus.BAD_GATEWAY, "transient_io", message);
    }

    public TransientIOException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "transient_io", message, cause);
    }
}
