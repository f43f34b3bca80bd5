package io.callflow.core.workflow.node;

/// How a phone transfer connects the caller.
public enum TransferType {
    /// The agent stays on the line while the destination is dialed.
    CONFERENCE("conference"),
    /// The caller is handed over without introduction.
    BLIND("blind");

    private final String wireName;

    TransferType(String wireName) {
        this.wireName = wireName;
    }

    /// Returns the `transfer_type` value used in the workflow JSON.
    ///
    /// @return wire name, never null
    public String wireName() {
        return wireName;
    }

    /// Resolves a configured transfer style.
    ///
    /// @param value configured style, may be null
    /// @return matching type, or null if the value names no known style
    public static TransferType fromWireName(String value) {
        for (TransferType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
