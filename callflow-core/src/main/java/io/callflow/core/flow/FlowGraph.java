package io.callflow.core.flow;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/// The user-authored flow graph: nodes and edges in declaration order.
///
/// Declaration order is significant. Entry resolution picks the first qualifying node,
/// and compiled edge ids and edge ordering follow the edge list, so the same lists
/// always compile to the same workflow.
///
/// Edges are not required to reference existing nodes; consumers must tolerate
/// dangling ids. When a node id is declared twice the first declaration wins.
///
/// @param nodes nodes in declaration order, not null (may be empty)
/// @param edges edges in declaration order, not null (may be empty)
public record FlowGraph(List<FlowNode> nodes, List<FlowEdge> edges) {

    private static final Logger logger = Logger.getLogger(FlowGraph.class.getName());

    /// Compact constructor normalizing null lists to empty.
    public FlowGraph {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    /// Creates a graph from the given lists.
    ///
    /// @param nodes nodes in declaration order, may be null
    /// @param edges edges in declaration order, may be null
    /// @return new graph, never null
    public static FlowGraph of(List<FlowNode> nodes, List<FlowEdge> edges) {
        return new FlowGraph(nodes, edges);
    }

    /// Builds an id index over the nodes, keeping the first declaration of a duplicate id.
    ///
    /// @return mutable map of node id to node, never null
    public Map<String, FlowNode> indexNodes() {
        Map<String, FlowNode> index = new HashMap<>();
        for (FlowNode node : nodes) {
            if (index.putIfAbsent(node.id(), node) != null) {
                logger.warning("Duplicate node id '" + node.id() + "', keeping first declaration");
            }
        }
        return index;
    }

    /// Finds a node by id.
    ///
    /// @param id node id, not null
    /// @return the first node declared with this id, or empty
    public Optional<FlowNode> findNode(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    /// Returns whether the graph has no nodes.
    ///
    /// @return true if the node list is empty
    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
