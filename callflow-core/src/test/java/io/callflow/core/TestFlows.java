package io.callflow.core;

import io.callflow.core.flow.FlowEdge;
import io.callflow.core.flow.FlowGraph;
import io.callflow.core.flow.FlowNode;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Shorthands for building authoring graphs in tests.
public final class TestFlows {

    private TestFlows() {}

    public static FlowNode node(String id, String type) {
        return FlowNode.of(id, type, Map.of());
    }

    public static FlowNode node(String id, String type, Map<String, Object> config) {
        return FlowNode.of(id, type, config);
    }

    public static FlowNode message(String id, String text) {
        return node(id, "message", Map.of("message", text));
    }

    public static FlowNode question(String id, String text) {
        return node(id, "question", Map.of("question", text));
    }

    public static FlowNode condition(String id) {
        return node(id, "condition");
    }

    public static FlowNode condition(String id, List<? extends Map<String, ?>> conditions) {
        return node(id, "condition", Map.of("conditions", conditions));
    }

    public static FlowEdge edge(String source, String target) {
        return FlowEdge.of("e_" + source + "_" + target, source, target);
    }

    public static FlowEdge edge(String source, String target, String handle) {
        return FlowEdge.fromHandle("e_" + source + "_" + handle + "_" + target, source, target, handle);
    }

    public static FlowEdge conditioned(String source, String target, String condition) {
        return new FlowEdge(
                "e_" + source + "_" + target, source, target, null, null, condition);
    }

    public static FlowGraph graph(List<FlowNode> nodes, FlowEdge... edges) {
        return FlowGraph.of(nodes, Arrays.asList(edges));
    }

    public static Map<String, Object> config(Object... keyValues) {
        Map<String, Object> config = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            config.put((String) keyValues[i], keyValues[i + 1]);
        }
        return config;
    }
}
