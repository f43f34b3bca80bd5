package io.callflow.core.compiler;

import io.callflow.core.flow.FlowEdge;
import io.callflow.core.flow.FlowGraph;
import io.callflow.core.flow.FlowNode;
import io.callflow.core.flow.NodeCategory;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Finds the first real step of a flow, the node the injected start node connects to.
///
/// Resolution order:
/// 1. the target of the first edge leaving the first trigger node, when that target
///    exists and is not itself structural
/// 2. the first node in declaration order that has no incoming edges and is neither a
///    trigger nor a condition
/// 3. the first node in declaration order that is neither a trigger nor a condition
public final class EntryResolver {

    private static final Logger logger = Logger.getLogger(EntryResolver.class.getName());

    /// Resolves the entry node.
    ///
    /// @param graph authoring graph, not null
    /// @return entry node, or empty if the graph holds no actionable node
    public Optional<FlowNode> resolve(FlowGraph graph) {
        return resolve(graph, graph.indexNodes());
    }

    Optional<FlowNode> resolve(FlowGraph graph, Map<String, FlowNode> index) {
        Optional<FlowNode> fromTrigger = followTrigger(graph, index);
        if (fromTrigger.isPresent()) {
            return fromTrigger;
        }

        Set<String> targets = new HashSet<>();
        for (FlowEdge edge : graph.edges()) {
            targets.add(edge.target());
        }
        for (FlowNode node : graph.nodes()) {
            if (isActionable(node) && !targets.contains(node.id())) {
                return Optional.of(node);
            }
        }

        Optional<FlowNode> fallback =
                graph.nodes().stream().filter(EntryResolver::isActionable).findFirst();
        fallback.ifPresent(
                node ->
                        logger.fine(
                                "Every node has incoming edges, using first actionable node "
                                        + node.id()));
        return fallback;
    }

    private static Optional<FlowNode> followTrigger(FlowGraph graph, Map<String, FlowNode> index) {
        Optional<FlowNode> trigger =
                graph.nodes().stream().filter(n -> n.category() == NodeCategory.START).findFirst();
        if (trigger.isEmpty()) {
            return Optional.empty();
        }
        String triggerId = trigger.get().id();
        Optional<FlowEdge> outgoing =
                graph.edges().stream().filter(e -> e.source().equals(triggerId)).findFirst();
        if (outgoing.isEmpty()) {
            return Optional.empty();
        }
        FlowNode target = index.get(outgoing.get().target());
        if (target == null || !isActionable(target)) {
            logger.fine("Trigger " + triggerId + " does not lead to an actionable node");
            return Optional.empty();
        }
        return Optional.of(target);
    }

    private static boolean isActionable(FlowNode node) {
        return !node.category().isStructural();
    }
}
