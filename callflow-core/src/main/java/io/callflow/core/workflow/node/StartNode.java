package io.callflow.core.workflow.node;

import io.callflow.core.Position;
import java.util.List;

/// The single entry point of a compiled workflow.
///
/// Never produced from an authoring node: the assembler injects it and connects it
/// unconditionally to the resolved entry node.
///
/// @param position canvas position, not null
/// @param edgeOrder ordered outgoing edge ids, not null
public record StartNode(Position position, List<String> edgeOrder) implements WorkflowNode {

    /// Compact constructor with defensive copies.
    public StartNode {
        position = position != null ? position : Position.origin();
        edgeOrder = edgeOrder != null ? List.copyOf(edgeOrder) : List.of();
    }

    /// Creates a start node at the origin with no edges yet.
    ///
    /// @return new start node, never null
    public static StartNode create() {
        return new StartNode(Position.origin(), List.of());
    }

    @Override
    public WorkflowNodeType nodeType() {
        return WorkflowNodeType.START;
    }

    @Override
    public StartNode withEdgeOrder(List<String> edgeOrder) {
        return new StartNode(position, edgeOrder);
    }
}
