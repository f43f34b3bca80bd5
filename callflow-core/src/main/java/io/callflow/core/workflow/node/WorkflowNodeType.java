package io.callflow.core.workflow.node;

/// Node kinds of the target workflow format, with their wire names.
///
/// The wire names are sent verbatim to the voice-agent platform and must not change.
public enum WorkflowNodeType {
    START("start"),
    END("end"),
    OVERRIDE_AGENT("override_agent"),
    PHONE_NUMBER("phone_number"),
    STANDALONE_AGENT("standalone_agent"),
    TOOL("tool");

    private final String wireName;

    WorkflowNodeType(String wireName) {
        this.wireName = wireName;
    }

    /// Returns the `type` value used in the workflow JSON.
    ///
    /// @return wire name, never null
    public String wireName() {
        return wireName;
    }

    /// Resolves a wire name back to its node type.
    ///
    /// @param wireName the `type` value from workflow JSON, not null
    /// @return matching node type, never null
    /// @throws IllegalArgumentException if the wire name is unknown
    public static WorkflowNodeType fromWireName(String wireName) {
        for (WorkflowNodeType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown workflow node type: " + wireName);
    }

    /// Returns whether a node of this type ends the scripted conversation.
    ///
    /// Terminal nodes hand the call off or hang up, so they legitimately have no
    /// outgoing edges.
    ///
    /// @return true for end, phone transfer and agent handoff nodes
    public boolean isTerminal() {
        return this == END || this == PHONE_NUMBER || this == STANDALONE_AGENT;
    }
}
