package org.nowstart.stratagem.data.exception;

import org.springframework.http.HttpStatus;

/**
 * A write or transition the session state does not allow, such as a non-owner payload write.
 */
public class StateConsistencyException extends PipelineException {

    public StateConsistencyException(String message) {
        super(HttpStatus.CONFLICT, "state_conflict", message);
    }
}
