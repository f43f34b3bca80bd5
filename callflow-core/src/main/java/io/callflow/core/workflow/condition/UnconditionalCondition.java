package io.callflow.core.workflow.condition;

/// Transition taken as soon as the source step finishes.
public record UnconditionalCondition() implements ForwardCondition {

    static final UnconditionalCondition INSTANCE = new UnconditionalCondition();

    public static final String TYPE = "unconditional";

    @Override
    public String typeName() {
        return TYPE;
    }
}
