package org.nowstart.stratagem.pipeline;

import java.util.List;
import org.nowstart.stratagem.data.exception.ValidationException;
import org.nowstart.stratagem.data.type.NodeExecutionState;
import org.nowstart.stratagem.strategy.ValidationResult;

public record NodeOutcome(NodeExecutionState result, List<String> errors, List<String> warnings, Throwable cause) {

    public NodeOutcome {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static NodeOutcome success() {
        return new NodeOutcome(NodeExecutionState.SUCCEEDED, List.of(), List.of(), null);
    }

    public static NodeOutcome softFailure(List<String> warnings) {
        return new NodeOutcome(NodeExecutionState.SOFT_FAILED, List.of(), warnings, null);
    }

    public static NodeOutcome softFailure(String warning) {
        return softFailure(List.of(warning));
    }

    public static NodeOutcome hardFailure(String error, Throwable cause) {
        return new NodeOutcome(NodeExecutionState.HARD_FAILED, List.of(error), List.of(), cause);
    }

    /**
     * Errors fail the node hard, warnings alone make it a soft failure.
     */
    public static NodeOutcome fromValidation(ValidationResult result) {
        if (!result.ok()) {
            return new NodeOutcome(
                    NodeExecutionState.HARD_FAILED,
                    result.errors(),
                    result.warnings(),
                    new ValidationException(true, result.errors())
            );
        }
        if (!result.warnings().isEmpty()) {
            return softFailure(result.warnings());
        }
        return success();
    }

    public boolean isHardFailure() {
        return result == NodeExecutionState.HARD_FAILED;
    }

    public boolean isSoftFailure() {
        return result == NodeExecutionState.SOFT_FAILED;
    }
}
