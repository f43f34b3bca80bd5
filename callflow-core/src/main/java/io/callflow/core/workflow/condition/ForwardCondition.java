package io.callflow.core.workflow.condition;

/// Rule attached to a workflow edge that decides when the runtime may take it.
///
/// Implementations are immutable records. The `type` discriminator written on the wire
/// comes from {@link #typeName()}.
///
/// ### Variants
/// - {@link UnconditionalCondition} - always take the edge
/// - {@link LlmCondition} - natural-language judgment evaluated by the runtime's model
/// - {@link ResultCondition} - branch on the success of a preceding tool call
/// - {@link ExpressionCondition} - opaque boolean expression, passed through untouched
public sealed interface ForwardCondition
        permits UnconditionalCondition, LlmCondition, ResultCondition, ExpressionCondition {

    /// Returns the wire discriminator of this condition.
    ///
    /// @return type name, never null
    String typeName();

    /// Returns the shared unconditional instance.
    ///
    /// @return unconditional condition, never null
    static ForwardCondition unconditional() {
        return UnconditionalCondition.INSTANCE;
    }

    /// Creates a natural-language condition.
    ///
    /// @param condition text evaluated by the runtime, not null
    /// @return llm condition, never null
    static ForwardCondition llm(String condition) {
        return new LlmCondition(condition);
    }
}
