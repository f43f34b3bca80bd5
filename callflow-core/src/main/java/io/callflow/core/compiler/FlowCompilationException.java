package io.callflow.core.compiler;

import java.io.Serial;

/// Thrown when an authoring graph cannot be compiled at all.
///
/// Malformed graph content does not raise this exception: it degrades to warnings and is
/// reported by the workflow validator. Only unusable input (a missing or empty graph) and,
/// under {@link CompilerOptions#strict()}, dangling edge references fail the compile.
public class FlowCompilationException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4471830982651137802L;

    /// Creates exception with message.
    ///
    /// @param message description of why compilation failed
    public FlowCompilationException(String message) {
        super(message);
    }
}
