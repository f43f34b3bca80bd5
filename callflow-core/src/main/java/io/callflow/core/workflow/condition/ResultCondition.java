package io.callflow.core.workflow.condition;

/// Transition keyed on whether the preceding tool invocation succeeded.
///
/// @param successful the tool outcome this edge follows
public record ResultCondition(boolean successful) implements ForwardCondition {

    public static final String TYPE = "result";

    @Override
    public String typeName() {
        return TYPE;
    }
}
