package io.callflow.core.workflow.node;

import io.callflow.core.Position;
import java.util.List;
import java.util.Objects;

/// Transfers the call to a phone number.
///
/// @param position canvas position, not null
/// @param edgeOrder ordered outgoing edge ids, not null
/// @param phoneNumber destination number, not null (may be empty when unconfigured)
/// @param transferType conference or blind transfer, not null
public record PhoneNumberNode(
        Position position, List<String> edgeOrder, String phoneNumber, TransferType transferType)
        implements WorkflowNode {

    /// Compact constructor with validation.
    public PhoneNumberNode {
        position = position != null ? position : Position.origin();
        edgeOrder = edgeOrder != null ? List.copyOf(edgeOrder) : List.of();
        phoneNumber = phoneNumber != null ? phoneNumber : "";
        Objects.requireNonNull(transferType, "transferType must not be null");
    }

    @Override
    public WorkflowNodeType nodeType() {
        return WorkflowNodeType.PHONE_NUMBER;
    }

    @Override
    public PhoneNumberNode withEdgeOrder(List<String> edgeOrder) {
        return new PhoneNumberNode(position, edgeOrder, phoneNumber, transferType);
    }
}
