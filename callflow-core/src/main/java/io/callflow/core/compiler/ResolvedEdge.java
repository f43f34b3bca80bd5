package io.callflow.core.compiler;

import io.callflow.core.workflow.condition.ForwardCondition;
import java.util.Objects;

/// Edge between two real nodes with its synthesized condition, before ids are assigned.
///
/// @param source source node id, not null
/// @param target target node id, not null
/// @param condition forward condition, not null
/// @param originEdgeId id of the authoring edge this was derived from, not null
public record ResolvedEdge(
        String source, String target, ForwardCondition condition, String originEdgeId) {

    public ResolvedEdge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(originEdgeId, "originEdgeId must not be null");
    }
}
