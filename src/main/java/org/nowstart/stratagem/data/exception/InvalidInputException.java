package org.nowstart.stratagem.data.exception;

import org.springframework.http.HttpStatus;

/**
 * Input the caller has to correct: malformed ticker, unparseable model output, rejected credentials.
 */
public class InvalidInputException extends PipelineException {

    public InvalidInputException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_input", message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_input", message, cause);
    }
}
