package io.callflow.core.workflow;

import io.callflow.core.workflow.node.WorkflowNode;
import io.callflow.core.workflow.node.WorkflowNodeType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Immutable compiled workflow in the voice-agent runtime's state-machine shape.
///
/// Nodes and edges are keyed by id and kept in insertion order: the injected start node
/// comes first, then compiled nodes in authoring order; edges follow the authoring edge
/// order with the start edge last. Each node's `edgeOrder` lists its outgoing edge ids in
/// the order the runtime uses to break ties between matching transitions.
///
/// Unlike the authoring graph, a workflow is not validated on build: dangling references
/// and unreachable nodes are reported by
/// {@link io.callflow.core.validation.WorkflowValidator} instead, so that workflows read back
/// from the wire can still be inspected.
///
/// @implNote Immutable and thread-safe after construction.
public final class Workflow {

    /// Id of the start node injected into every compiled workflow.
    public static final String START_NODE_ID = "start_node";

    private final Map<String, WorkflowNode> nodes;
    private final Map<String, WorkflowEdge> edges;

    private Workflow(Builder builder) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(builder.edges));
    }

    /// Returns all nodes by id, in insertion order.
    ///
    /// @return unmodifiable ordered node map, never null
    public Map<String, WorkflowNode> getNodes() {
        return nodes;
    }

    /// Returns all edges by id, in insertion order.
    ///
    /// @return unmodifiable ordered edge map, never null
    public Map<String, WorkflowEdge> getEdges() {
        return edges;
    }

    /// Counts nodes of the given kind.
    ///
    /// @param type node kind, not null
    /// @return number of matching nodes
    public long countNodes(WorkflowNodeType type) {
        return nodes.values().stream().filter(n -> n.nodeType() == type).count();
    }

    /// Creates a new workflow builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Workflow other)) {
            return false;
        }
        return nodes.equals(other.nodes) && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges);
    }

    @Override
    public String toString() {
        return "Workflow{nodes=" + nodes.keySet() + ", edges=" + edges.keySet() + "}";
    }

    /// Builder for constructing immutable workflows. Preserves insertion order.
    public static final class Builder {
        private final Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
        private final Map<String, WorkflowEdge> edges = new LinkedHashMap<>();

        private Builder() {}

        /// Replaces all nodes.
        ///
        /// @param nodes ordered node map, not null
        /// @return this builder for chaining
        public Builder nodes(Map<String, WorkflowNode> nodes) {
            this.nodes.clear();
            this.nodes.putAll(nodes);
            return this;
        }

        /// Replaces all edges.
        ///
        /// @param edges ordered edge map, not null
        /// @return this builder for chaining
        public Builder edges(Map<String, WorkflowEdge> edges) {
            this.edges.clear();
            this.edges.putAll(edges);
            return this;
        }

        /// Adds or replaces a single node.
        ///
        /// @param id node id, not null
        /// @param node node definition, not null
        /// @return this builder for chaining
        public Builder node(String id, WorkflowNode node) {
            nodes.put(Objects.requireNonNull(id, "id"), Objects.requireNonNull(node, "node"));
            return this;
        }

        /// Adds or replaces a single edge.
        ///
        /// @param id edge id, not null
        /// @param edge edge definition, not null
        /// @return this builder for chaining
        public Builder edge(String id, WorkflowEdge edge) {
            edges.put(Objects.requireNonNull(id, "id"), Objects.requireNonNull(edge, "edge"));
            return this;
        }

        /// Builds the immutable workflow.
        ///
        /// @return new workflow, never null
        public Workflow build() {
            return new Workflow(this);
        }
    }
}
