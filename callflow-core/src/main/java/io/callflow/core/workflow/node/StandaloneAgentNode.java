package io.callflow.core.workflow.node;

import io.callflow.core.Position;
import java.util.List;

/// Hands the conversation off to another agent.
///
/// @param position canvas position, not null
/// @param edgeOrder ordered outgoing edge ids, not null
/// @param agentId target agent identifier, not null (may be empty when unconfigured)
/// @param delayMs delay before the handoff in milliseconds, zero or positive
/// @param enableTransferredAgentFirstMessage whether the target agent speaks its own first message
public record StandaloneAgentNode(
        Position position,
        List<String> edgeOrder,
        String agentId,
        long delayMs,
        boolean enableTransferredAgentFirstMessage)
        implements WorkflowNode {

    /// First-message setting used when neither the editor config nor the wire document sets one.
    public static final boolean DEFAULT_FIRST_MESSAGE_ENABLED = true;

    /// Compact constructor with validation.
    public StandaloneAgentNode {
        position = position != null ? position : Position.origin();
        edgeOrder = edgeOrder != null ? List.copyOf(edgeOrder) : List.of();
        agentId = agentId != null ? agentId : "";
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must not be negative");
        }
    }

    @Override
    public WorkflowNodeType nodeType() {
        return WorkflowNodeType.STANDALONE_AGENT;
    }

    @Override
    public StandaloneAgentNode withEdgeOrder(List<String> edgeOrder) {
        return new StandaloneAgentNode(
                position, edgeOrder, agentId, delayMs, enableTransferredAgentFirstMessage);
    }
}
