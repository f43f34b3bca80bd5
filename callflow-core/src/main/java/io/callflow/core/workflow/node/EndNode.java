package io.callflow.core.workflow.node;

import io.callflow.core.Position;
import java.util.List;

/// Terminal node that ends the call. Carries no configuration.
///
/// @param position canvas position, not null
/// @param edgeOrder ordered outgoing edge ids, not null
public record EndNode(Position position, List<String> edgeOrder) implements WorkflowNode {

    /// Compact constructor with defensive copies.
    public EndNode {
        position = position != null ? position : Position.origin();
        edgeOrder = edgeOrder != null ? List.copyOf(edgeOrder) : List.of();
    }

    /// Creates an end node with no outgoing edges.
    ///
    /// @param position canvas position, may be null
    /// @return new end node, never null
    public static EndNode at(Position position) {
        return new EndNode(position, List.of());
    }

    @Override
    public WorkflowNodeType nodeType() {
        return WorkflowNodeType.END;
    }

    @Override
    public EndNode withEdgeOrder(List<String> edgeOrder) {
        return new EndNode(position, edgeOrder);
    }
}
