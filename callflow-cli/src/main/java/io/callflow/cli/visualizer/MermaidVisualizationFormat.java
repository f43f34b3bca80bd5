package io.callflow.cli.visualizer;

import io.callflow.core.workflow.Workflow;
import io.callflow.core.workflow.WorkflowEdge;
import io.callflow.core.workflow.condition.ExpressionCondition;
import io.callflow.core.workflow.condition.ResultCondition;
import io.callflow.core.workflow.node.OverrideAgentNode;
import io.callflow.core.workflow.node.WorkflowNode;
import jakarta.enterprise.context.ApplicationScoped;

/// Mermaid diagram format visualization for compiled workflows.
///
/// Generates Mermaid flowchart syntax wrapped in Markdown code blocks. Output can be rendered
/// in GitHub/GitLab Markdown, documentation tools, or at [mermaid.live](https://mermaid.live).
///
/// ### Node Shape Mapping
/// - **start**: Circle
/// - **end**: Stadium
/// - **override_agent**: Rectangle with the step label
/// - **phone_number**: Hexagon with the destination number
/// - **standalone_agent**: Subroutine with the target agent
/// - **tool**: Parallelogram with the tool ids
///
/// ### Edge Styles
/// - **Solid arrow** (`-->`) - unconditional and LLM transitions, the latter labelled
/// - **Dashed arrow** (`-.->`) - result and expression transitions
///
/// @implNote Thread-safe. Stateless rendering.
/// @see TextVisualizationFormat for ASCII output
@ApplicationScoped
public class MermaidVisualizationFormat implements VisualizationFormat {

    private static final int LABEL_LENGTH = 40;

    @Override
    public String getName() {
        return "mermaid";
    }

    @Override
    public String render(Workflow workflow) {
        StringBuilder sb = new StringBuilder();

        sb.append("```mermaid\n");
        sb.append("flowchart TD\n");

        for (var entry : workflow.getNodes().entrySet()) {
            renderNode(sb, entry.getKey(), entry.getValue());
        }

        sb.append("\n");

        for (WorkflowEdge edge : workflow.getEdges().values()) {
            renderEdge(sb, edge);
        }

        sb.append("```\n");
        return sb.toString();
    }

    private void renderNode(StringBuilder sb, String nodeId, WorkflowNode node) {
        String id = sanitizeId(nodeId);

        String shape =
                switch (node.nodeType()) {
                    case START -> id + "((\"start\"))";
                    case END -> id + "([\"" + escape(nodeId) + "\"])";
                    case OVERRIDE_AGENT -> {
                        String label = ((OverrideAgentNode) node).label();
                        yield id + "[\"" + escape(label.isEmpty() ? nodeId : label) + "\"]";
                    }
                    case PHONE_NUMBER ->
                            id + "{{\"" + escape(nodeId) + "\\n(transfer)\"}}";
                    case STANDALONE_AGENT ->
                            id + "[[\"" + escape(nodeId) + "\\n(agent handoff)\"]]";
                    case TOOL -> id + "[/\"" + escape(nodeId) + "\\n(tool)\"/]";
                };

        sb.append("    ").append(shape).append("\n");
    }

    private void renderEdge(StringBuilder sb, WorkflowEdge edge) {
        String fromId = sanitizeId(edge.source());
        String toId = sanitizeId(edge.target());
        String label = ConditionLabels.describe(edge.forwardCondition(), LABEL_LENGTH);

        sb.append("  ").append(fromId);
        if (label == null) {
            sb.append(" --> ");
        } else if (edge.forwardCondition() instanceof ResultCondition
                || edge.forwardCondition() instanceof ExpressionCondition) {
            sb.append(" -.->|").append(escape(label)).append("| ");
        } else {
            sb.append(" -->|\"").append(escape(label)).append("\"| ");
        }
        sb.append(toId).append("\n");
    }

    private String escape(String text) {
        return text.replace("\"", "#quot;");
    }

    private String sanitizeId(String id) {
        String sanitized = id.replaceAll("[^a-zA-Z0-9_]", "_");
        // Prefix reserved Mermaid keywords
        if (isReservedKeyword(sanitized)) {
            return "node_" + sanitized;
        }
        return sanitized;
    }

    private boolean isReservedKeyword(String id) {
        return switch (id.toLowerCase()) {
            case "end",
                    "subgraph",
                    "graph",
                    "flowchart",
                    "direction",
                    "click",
                    "style",
                    "classdef",
                    "class",
                    "linkstyle" ->
                    true;
            default -> false;
        };
    }
}
