package org.nowstart.stratagem.strategy;

import java.util.List;

public record ValidationResult(List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.stream().distinct().toList(), warnings.stream().distinct().toList());
    }

    public boolean ok() {
        return errors.isEmpty();
    }
}
