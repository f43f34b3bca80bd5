package io.callflow.core.compiler;

/// Compiler behavior switches.
///
/// @param strict when true, edges that reference nodes missing from the compiled graph
///     fail the compile with {@link FlowCompilationException} instead of being dropped
public record CompilerOptions(boolean strict) {

    private static final CompilerOptions DEFAULTS = new CompilerOptions(false);

    /// Returns the lenient defaults: dangling edges are dropped and logged.
    ///
    /// @return default options, never null
    public static CompilerOptions defaults() {
        return DEFAULTS;
    }

    /// Returns options that reject dangling edges.
    ///
    /// @return strict options, never null
    public static CompilerOptions strictMode() {
        return new CompilerOptions(true);
    }
}
