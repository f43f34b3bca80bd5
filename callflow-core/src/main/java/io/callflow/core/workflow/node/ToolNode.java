package io.callflow.core.workflow.node;

import io.callflow.core.Position;
import java.util.List;

/// Invokes externally registered tools, such as a webhook or an audio playback.
///
/// @param position canvas position, not null
/// @param edgeOrder ordered outgoing edge ids, not null
/// @param toolIds ids of the tools to invoke, not null
public record ToolNode(Position position, List<String> edgeOrder, List<String> toolIds)
        implements WorkflowNode {

    /// Compact constructor with defensive copies.
    public ToolNode {
        position = position != null ? position : Position.origin();
        edgeOrder = edgeOrder != null ? List.copyOf(edgeOrder) : List.of();
        toolIds = toolIds != null ? List.copyOf(toolIds) : List.of();
    }

    /// Creates a node invoking a single tool.
    ///
    /// @param position canvas position, may be null
    /// @param toolId registered tool id, not null
    /// @return new tool node, never null
    public static ToolNode invoking(Position position, String toolId) {
        return new ToolNode(position, List.of(), List.of(toolId));
    }

    @Override
    public WorkflowNodeType nodeType() {
        return WorkflowNodeType.TOOL;
    }

    @Override
    public ToolNode withEdgeOrder(List<String> edgeOrder) {
        return new ToolNode(position, edgeOrder, toolIds);
    }
}
