package io.callflow.core.workflow.condition;

/// Opaque boolean expression. Never synthesized by the compiler, only carried through
/// when a workflow is read back from its wire form.
///
/// @param expression expression tree as parsed from JSON (maps, lists, scalars), may be null
public record ExpressionCondition(Object expression) implements ForwardCondition {

    public static final String TYPE = "expression";

    @Override
    public String typeName() {
        return TYPE;
    }
}
