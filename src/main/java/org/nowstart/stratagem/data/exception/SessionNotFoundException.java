package org.nowstart.stratagem.data.exception;

import org.springframework.http.HttpStatus;

public class SessionNotFoundException extends PipelineException {

    public SessionNotFoundException(String sessionId) {
        super(HttpStatus.NOT_FOUND, "session_not_found", "No checkpoint found for session " + sessionId);
    }
}
