package io.callflow.core.flow;

import java.util.Objects;

/// A directed transition of the user-authored flow graph.
///
/// `sourceHandle` names the output port the edge leaves from when the editor exposes
/// discrete ports (`yes`, `no`, `transfer`, ...). `condition` is the optional
/// natural-language condition the author typed on the edge itself (`data.condition`
/// in the editor's JSON), which overrides every derived condition.
///
/// @param id edge identifier, not null
/// @param source source node id, not null
/// @param target target node id, not null
/// @param sourceHandle output port name, may be null
/// @param label display label, may be null
/// @param condition authoring-time condition text, may be null
public record FlowEdge(
        String id,
        String source,
        String target,
        String sourceHandle,
        String label,
        String condition) {

    /// Compact constructor with validation.
    public FlowEdge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        id = id != null ? id : source + "->" + target;
    }

    /// Creates a plain edge with no handle, label or condition.
    ///
    /// @param id edge identifier, may be null
    /// @param source source node id, not null
    /// @param target target node id, not null
    /// @return new edge, never null
    public static FlowEdge of(String id, String source, String target) {
        return new FlowEdge(id, source, target, null, null, null);
    }

    /// Creates an edge leaving a named output port.
    ///
    /// @param id edge identifier, may be null
    /// @param source source node id, not null
    /// @param target target node id, not null
    /// @param sourceHandle output port name, may be null
    /// @return new edge, never null
    public static FlowEdge fromHandle(String id, String source, String target, String sourceHandle) {
        return new FlowEdge(id, source, target, sourceHandle, null, null);
    }

    /// Returns whether the author attached an explicit condition to this edge.
    ///
    /// @return true if `condition` is non-blank
    public boolean hasExplicitCondition() {
        return condition != null && !condition.isBlank();
    }

    /// Returns the port name, falling back to the display label.
    ///
    /// @return handle or label, or null if neither is set
    public String handleOrLabel() {
        if (sourceHandle != null && !sourceHandle.isEmpty()) {
            return sourceHandle;
        }
        return label != null && !label.isEmpty() ? label : null;
    }
}
