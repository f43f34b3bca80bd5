package io.callflow.core.compiler;

import io.callflow.core.workflow.Workflow;
import io.callflow.core.workflow.WorkflowEdge;
import io.callflow.core.workflow.node.StartNode;
import io.callflow.core.workflow.node.WorkflowNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Combines compiled nodes and resolved edges into the final workflow.
///
/// Injects the `start_node`, assigns edge ids from the compilation's counter, records
/// every id in its source's edge order and adds the unconditional `start_to_entry` edge
/// last. Edges whose source or target was not compiled are dropped with a warning, or
/// rejected in strict mode.
final class WorkflowAssembler {

    private static final Logger logger = Logger.getLogger(WorkflowAssembler.class.getName());

    static final String START_EDGE_ID = "start_to_entry";

    private final CompilerOptions options;

    WorkflowAssembler(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    Workflow assemble(CompilationContext context, List<ResolvedEdge> edges, String entryNodeId) {
        Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
        nodes.put(Workflow.START_NODE_ID, StartNode.create());
        nodes.putAll(context.compiledNodes());

        Map<String, List<String>> edgeOrders = new LinkedHashMap<>();
        Map<String, WorkflowEdge> compiledEdges = new LinkedHashMap<>();

        for (ResolvedEdge edge : edges) {
            if (!nodes.containsKey(edge.source()) || !nodes.containsKey(edge.target())) {
                String message =
                        "Edge "
                                + edge.originEdgeId()
                                + " references a node that is not in the compiled workflow ("
                                + edge.source()
                                + " -> "
                                + edge.target()
                                + ")";
                if (options.strict()) {
                    throw new FlowCompilationException(message);
                }
                logger.warning(message + ", dropping it");
                continue;
            }
            String id = context.nextEdgeId(edge.source(), edge.target());
            compiledEdges.put(id, new WorkflowEdge(edge.source(), edge.target(), edge.condition()));
            edgeOrders.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(id);
        }

        if (entryNodeId != null && nodes.containsKey(entryNodeId)) {
            compiledEdges.put(
                    START_EDGE_ID, WorkflowEdge.unconditional(Workflow.START_NODE_ID, entryNodeId));
            edgeOrders
                    .computeIfAbsent(Workflow.START_NODE_ID, k -> new ArrayList<>())
                    .add(START_EDGE_ID);
            logger.fine("Connected start -> " + entryNodeId);
        }

        Workflow.Builder builder = Workflow.builder();
        for (Map.Entry<String, WorkflowNode> entry : nodes.entrySet()) {
            List<String> order = edgeOrders.get(entry.getKey());
            WorkflowNode node =
                    order != null ? entry.getValue().withEdgeOrder(order) : entry.getValue();
            builder.node(entry.getKey(), node);
        }
        return builder.edges(compiledEdges).build();
    }
}
