package io.callflow.core.workflow.node;

import io.callflow.core.Position;
import java.util.List;

/// Sealed interface for compiled workflow nodes.
///
/// Every node carries its canvas position and `edge_order`, the ordered ids of its
/// outgoing edges. The target runtime evaluates transitions in that order, so it
/// decides which edge wins when several conditions match.
///
/// ### Permitted Implementations
/// - {@link StartNode} - injected entry point
/// - {@link EndNode} - hang up
/// - {@link OverrideAgentNode} - scripted conversational step
/// - {@link PhoneNumberNode} - transfer to a phone number
/// - {@link StandaloneAgentNode} - handoff to another agent
/// - {@link ToolNode} - invocation of a registered tool
///
/// @implNote Implementations are immutable records. Edge order is attached after
/// edge resolution via {@link #withEdgeOrder(List)}, which returns a copy.
public sealed interface WorkflowNode
        permits EndNode,
                OverrideAgentNode,
                PhoneNumberNode,
                StandaloneAgentNode,
                StartNode,
                ToolNode {

    /// Returns the node type for serialization dispatch.
    ///
    /// @return node type, never null
    WorkflowNodeType nodeType();

    /// Returns the canvas position.
    ///
    /// @return position, never null
    Position position();

    /// Returns the ordered outgoing edge ids.
    ///
    /// @return unmodifiable list of edge ids, never null (may be empty)
    List<String> edgeOrder();

    /// Returns a copy of this node with the given outgoing edge order.
    ///
    /// @param edgeOrder ordered outgoing edge ids, not null
    /// @return new node instance, never null
    WorkflowNode withEdgeOrder(List<String> edgeOrder);
}
