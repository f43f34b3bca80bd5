package io.callflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.callflow.core.Position;
import io.callflow.core.flow.FlowEdge;
import io.callflow.core.flow.FlowGraph;
import io.callflow.core.flow.FlowNode;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Reads the visual editor's saved graph.
///
/// Expected shape:
/// ```
/// {
///   "nodes": [{"id", "type", "position": {"x", "y"}, "data": {"label", "config": {...}}}],
///   "edges": [{"id", "source", "target", "sourceHandle", "label", "data": {"condition"}}]
/// }
/// ```
///
/// Node `data` is kept as an open map. Fields the compiler does not know about are ignored.
/// Nodes without an id and edges without both endpoints are rejected, since nothing
/// downstream could refer to them.
class FlowGraphDeserializer extends StdDeserializer<FlowGraph> {

    @Serial private static final long serialVersionUID = 6532079114877303951L;

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    FlowGraphDeserializer() {
        super(FlowGraph.class);
    }

    @Override
    public FlowGraph deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        List<FlowNode> nodes = new ArrayList<>();
        for (JsonNode node : root.path("nodes")) {
            nodes.add(readNode(mapper, node));
        }

        List<FlowEdge> edges = new ArrayList<>();
        for (JsonNode edge : root.path("edges")) {
            edges.add(readEdge(edge));
        }

        return FlowGraph.of(nodes, edges);
    }

    private FlowNode readNode(ObjectMapper mapper, JsonNode node) throws IOException {
        String id = text(node, "id");
        if (id == null) {
            throw new IOException("Flow node without id: " + node);
        }
        JsonNode position = node.get("position");
        Position pos =
                position != null && position.isObject()
                        ? new Position(
                                position.path("x").asDouble(0), position.path("y").asDouble(0))
                        : Position.origin();
        Map<String, Object> data =
                node.hasNonNull("data") ? mapper.convertValue(node.get("data"), OBJECT_MAP) : null;
        return new FlowNode(id, text(node, "type"), pos, data);
    }

    private FlowEdge readEdge(JsonNode edge) throws IOException {
        String source = text(edge, "source");
        String target = text(edge, "target");
        if (source == null || target == null) {
            throw new IOException("Flow edge requires source and target: " + edge);
        }
        return new FlowEdge(
                text(edge, "id"),
                source,
                target,
                text(edge, "sourceHandle"),
                text(edge, "label"),
                text(edge.path("data"), "condition"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
