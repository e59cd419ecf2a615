package org.nowstart.stratagem.data.exception;

import org.springframework.http.HttpStatus;

public class ConcurrencyConflictException extends PipelineException {

    public ConcurrencyConflictException(String sessionId) {
        super(HttpStatus.CONFLICT, "concurrent_execution", "Session is already executing. sessionId=" + sessionId);
    }
}
