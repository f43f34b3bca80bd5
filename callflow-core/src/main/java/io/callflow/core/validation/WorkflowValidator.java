package io.callflow.core.validation;

import io.callflow.core.workflow.Workflow;
import io.callflow.core.workflow.WorkflowEdge;
import io.callflow.core.workflow.node.WorkflowNode;
import io.callflow.core.workflow.node.WorkflowNodeType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Structural checks over a compiled workflow.
///
/// ### Errors
/// - fewer than two nodes
/// - no start node
/// - an edge whose source or target is not a node
///
/// ### Warnings
/// - a node that a forward traversal from the start node never reaches
/// - a node without outgoing edges that is not a start, end, phone transfer or agent
///   handoff
///
/// Pure and stateless; safe to share.
public final class WorkflowValidator {

    /// Validates a workflow.
    ///
    /// @param workflow compiled workflow, not null
    /// @return validation result, never null
    public ValidationResult validate(Workflow workflow) {
        Map<String, WorkflowNode> nodes = workflow.getNodes();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (nodes.size() <= 1) {
            errors.add("Workflow must have at least one node besides start");
        }

        Optional<String> startId = findStart(nodes);
        if (startId.isEmpty()) {
            errors.add("Workflow must have a start node");
        }

        for (Map.Entry<String, WorkflowEdge> entry : workflow.getEdges().entrySet()) {
            WorkflowEdge edge = entry.getValue();
            if (!nodes.containsKey(edge.target())) {
                errors.add("Edge " + entry.getKey() + " targets non-existent node " + edge.target());
            }
            if (!nodes.containsKey(edge.source())) {
                errors.add("Edge " + entry.getKey() + " has non-existent source " + edge.source());
            }
        }

        Set<String> reachable = startId.map(id -> reachableFrom(id, workflow)).orElse(Set.of());
        for (Map.Entry<String, WorkflowNode> entry : nodes.entrySet()) {
            if (entry.getValue().nodeType() == WorkflowNodeType.START) {
                continue;
            }
            if (!reachable.contains(entry.getKey())) {
                warnings.add("Node " + entry.getKey() + " is not reachable from the start node");
            }
        }

        for (Map.Entry<String, WorkflowNode> entry : nodes.entrySet()) {
            WorkflowNode node = entry.getValue();
            if (node.nodeType() == WorkflowNodeType.START || node.nodeType().isTerminal()) {
                continue;
            }
            if (node.edgeOrder().isEmpty()) {
                warnings.add("Node " + entry.getKey() + " has no outgoing edges");
            }
        }

        return ValidationResult.of(errors, warnings);
    }

    private static Optional<String> findStart(Map<String, WorkflowNode> nodes) {
        if (nodes.containsKey(Workflow.START_NODE_ID)
                && nodes.get(Workflow.START_NODE_ID).nodeType() == WorkflowNodeType.START) {
            return Optional.of(Workflow.START_NODE_ID);
        }
        return nodes.entrySet().stream()
                .filter(e -> e.getValue().nodeType() == WorkflowNodeType.START)
                .map(Map.Entry::getKey)
                .findFirst();
    }

    private static Set<String> reachableFrom(String startId, Workflow workflow) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (WorkflowEdge edge : workflow.getEdges().values()) {
            adjacency.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
        }
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(startId);
        queue.add(startId);
        while (!queue.isEmpty()) {
            for (String next : adjacency.getOrDefault(queue.poll(), List.of())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }
}
