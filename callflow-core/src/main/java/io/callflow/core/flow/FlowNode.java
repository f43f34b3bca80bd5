package io.callflow.core.flow;

import io.callflow.core.Position;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A node of the user-authored flow graph.
///
/// Mirrors the shape the visual editor stores: an id, a node type, a canvas position
/// and an open `data` map. The step configuration lives under `data.config`; the
/// editor's display label under `data.label`. Some templates put settings directly on
/// `data` instead of `data.config`, so both are exposed.
///
/// ### Category resolution
/// The effective category is taken from `config.type` when present, else from the
/// node's own `type`, else `unknown`. See {@link #rawCategory()}.
///
/// @param id unique node identifier within the graph, not null
/// @param type editor node type, may be null
/// @param position canvas position, defaults to the origin when null
/// @param data open node data, defaults to empty when null
public record FlowNode(String id, String type, Position position, Map<String, Object> data) {

    /// Compact constructor with validation.
    public FlowNode {
        Objects.requireNonNull(id, "id must not be null");
        position = position != null ? position : Position.origin();
        data =
                data != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(data))
                        : Map.of();
    }

    /// Creates a node whose data holds only a config map, the common editor shape.
    ///
    /// @param id unique node identifier, not null
    /// @param type editor node type, may be null
    /// @param config step configuration, may be null
    /// @return new node positioned at the origin, never null
    public static FlowNode of(String id, String type, Map<String, Object> config) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (config != null) {
            data.put("config", config);
        }
        return new FlowNode(id, type, Position.origin(), data);
    }

    /// Returns the step configuration from `data.config`.
    ///
    /// @return config view, empty when the node carries no config, never null
    @SuppressWarnings("unchecked")
    public NodeConfig config() {
        return data.get("config") instanceof Map<?, ?> m
                ? NodeConfig.of((Map<String, Object>) m)
                : NodeConfig.empty();
    }

    /// Returns the node's `data` map as a config view.
    ///
    /// Used for settings that templates store beside `config` rather than inside it.
    ///
    /// @return data view, never null
    public NodeConfig dataView() {
        return NodeConfig.of(data);
    }

    /// Returns the editor's display label from `data.label`.
    ///
    /// @return label, or null if absent or blank
    public String label() {
        return data.get("label") instanceof String s && !s.isBlank() ? s : null;
    }

    /// Returns the raw category tag: `config.type`, else `type`, else `unknown`.
    ///
    /// @return raw category string, never null
    public String rawCategory() {
        String configType = config().text("type");
        if (configType != null) {
            return configType;
        }
        return type != null && !type.isEmpty() ? type : "unknown";
    }

    /// Returns the resolved semantic category.
    ///
    /// @return category, {@link NodeCategory#UNKNOWN} for unrecognized tags, never null
    public NodeCategory category() {
        return NodeCategory.of(rawCategory());
    }
}
