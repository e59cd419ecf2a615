package org.nowstart.stratagem.data.exception;

import java.util.List;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class ValidationException extends PipelineException {

    private final boolean critical;
    private final List<String> issues;

    public ValidationException(boolean critical, List<String> issues) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, critical ? "validation_error" : "validation_warning", String.join("; ", issues));
        this.critical = critical;
        this.issues = List.copyOf(issues);
    }
}
