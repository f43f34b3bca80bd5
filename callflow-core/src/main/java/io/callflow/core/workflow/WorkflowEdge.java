package io.callflow.core.workflow;

import io.callflow.core.workflow.condition.ForwardCondition;
import java.util.Objects;

/// Directed transition between two compiled workflow nodes.
///
/// @param source source node id, not null
/// @param target target node id, not null
/// @param forwardCondition rule deciding when the transition fires, not null
public record WorkflowEdge(String source, String target, ForwardCondition forwardCondition) {

    public WorkflowEdge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(forwardCondition, "forwardCondition must not be null");
    }

    /// Creates an edge that always fires.
    ///
    /// @param source source node id, not null
    /// @param target target node id, not null
    /// @return new edge, never null
    public static WorkflowEdge unconditional(String source, String target) {
        return new WorkflowEdge(source, target, ForwardCondition.unconditional());
    }
}
