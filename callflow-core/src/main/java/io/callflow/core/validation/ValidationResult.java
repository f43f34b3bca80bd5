package io.callflow.core.validation;

import java.util.List;

/// Outcome of validating a compiled workflow.
///
/// Errors make the workflow unusable; warnings flag suspicious but deployable shapes.
///
/// @param valid true when there are no errors
/// @param errors error messages, never null
/// @param warnings warning messages, never null
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /// Creates a result whose validity follows from the error list.
    ///
    /// @param errors error messages, not null
    /// @param warnings warning messages, not null
    /// @return result, never null
    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    /// Returns whether any warning was raised.
    ///
    /// @return true if warnings are present
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
