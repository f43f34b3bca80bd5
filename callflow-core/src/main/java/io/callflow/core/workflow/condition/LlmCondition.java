package io.callflow.core.workflow.condition;

import java.util.Objects;

/// Transition judged by the runtime's language model against a natural-language rule.
///
/// @param condition rule text, not null or blank
public record LlmCondition(String condition) implements ForwardCondition {

    public static final String TYPE = "llm";

    public LlmCondition {
        Objects.requireNonNull(condition, "condition must not be null");
        if (condition.isBlank()) {
            throw new IllegalArgumentException("condition must not be blank");
        }
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
